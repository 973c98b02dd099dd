package com.lessonflow.orchestrator.client;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.lessonflow.orchestrator.support.PropertiesFixture;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestClient;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.content;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.header;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.jsonPath;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class SchoolApiClientTest {

    private MockRestServiceServer server;
    private SchoolApiClient client;

    @BeforeEach
    void setUp() {
        RestClient.Builder builder = RestClient.builder();
        server = MockRestServiceServer.bindTo(builder).build();
        client = new SchoolApiClient(builder.build(), new ObjectMapper(), PropertiesFixture.create());
    }

    @Test
    @DisplayName("학교 조회: 목록 첫 항목의 school_id, API 키 헤더 포함")
    void resolveSchoolId_readsFirstRow() {
        // given
        server.expect(requestTo("http://gateway.test/school"))
                .andExpect(method(HttpMethod.POST))
                .andExpect(header("x-api-key", "test-key"))
                .andExpect(jsonPath("$.email").value("tenant@school.org"))
                .andRespond(withSuccess("[{\"school_id\": 3, \"name\": \"SC\"}]", MediaType.APPLICATION_JSON));

        // when & then
        assertThat(client.resolveSchoolId("tenant@school.org")).contains("3");
        server.verify();
    }

    @Test
    @DisplayName("학교 조회: 빈 목록이면 empty")
    void resolveSchoolId_emptyList() {
        // given
        server.expect(requestTo("http://gateway.test/school"))
                .andRespond(withSuccess("[]", MediaType.APPLICATION_JSON));

        // when & then
        assertThat(client.resolveSchoolId("tenant@school.org")).isEmpty();
    }

    @Test
    @DisplayName("과목 등록: inserted_subject_id 반환, payload 필드 이름은 게이트웨이 형식")
    void insertSubject_returnsInsertedId() {
        // given
        server.expect(requestTo("http://gateway.test/subject"))
                .andExpect(content().json("{\"name\":\"Algebra\",\"grade\":\"9\",\"section\":\"B\","
                        + "\"school_id\":\"3\",\"period\":\"2\"}"))
                .andRespond(withSuccess("{\"inserted_subject_id\": 501}", MediaType.APPLICATION_JSON));

        // when & then
        assertThat(client.insertSubject(new SubjectRegistration("Algebra", "9", "B", "2", "3"))).contains("501");
    }

    @Test
    @DisplayName("과목 등록: 200이지만 빈 본문이면 empty, 비200이면 예외")
    void insertSubject_lenientBodyAndFailure() {
        // given
        server.expect(requestTo("http://gateway.test/subject")).andRespond(withSuccess());
        server.expect(requestTo("http://gateway.test/subject")).andRespond(withServerError().body("oops"));
        SubjectRegistration registration = new SubjectRegistration("Algebra", "9", "B", "2", "3");

        // when & then
        assertThat(client.insertSubject(registration)).isEmpty();
        assertThatThrownBy(() -> client.insertSubject(registration))
                .isInstanceOf(ExternalCallException.class)
                .hasMessageContaining("500");
    }
}
