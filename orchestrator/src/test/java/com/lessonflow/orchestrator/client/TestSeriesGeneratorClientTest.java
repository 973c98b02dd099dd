package com.lessonflow.orchestrator.client;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.lessonflow.orchestrator.support.PropertiesFixture;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestClient;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.jsonPath;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class TestSeriesGeneratorClientTest {

    private static final String URL = "http://generator.test/itp/initialize";

    private MockRestServiceServer server;
    private TestSeriesGeneratorClient client;

    @BeforeEach
    void setUp() {
        RestClient.Builder builder = RestClient.builder();
        server = MockRestServiceServer.bindTo(builder).build();
        client = new TestSeriesGeneratorClient(builder.build(), new ObjectMapper(), PropertiesFixture.create());
    }

    @Test
    @DisplayName("본문의 {statusCode, body}가 Envelope가 된다")
    void initialize_readsEnvelopeFromBody() {
        // given
        server.expect(requestTo(URL))
                .andExpect(jsonPath("$.user_id").value("s@school.org"))
                .andRespond(withSuccess("{\"statusCode\":200,\"body\":{\"generating\":true,\"id\":\"itp-1\"}}",
                        MediaType.APPLICATION_JSON));

        // when
        GeneratorEnvelope envelope = client.initialize(Map.of("user_id", "s@school.org"));

        // then
        assertThat(envelope.isGenerating()).isTrue();
        assertThat(envelope.jobId()).isEqualTo("itp-1");
    }

    @Test
    @DisplayName("body가 JSON 문자열이면 풀어서 읽는다")
    void initialize_unwrapsStringBody() {
        // given
        server.expect(requestTo(URL))
                .andRespond(withSuccess("{\"statusCode\":400,\"body\":\"{\\\"message\\\":\\\"exists\\\"}\"}",
                        MediaType.APPLICATION_JSON));

        // when
        GeneratorEnvelope envelope = client.initialize(Map.of());

        // then
        assertThat(envelope.statusCode()).isEqualTo(400);
        assertThat(envelope.body().path("message").asText()).isEqualTo("exists");
    }

    @Test
    @DisplayName("statusCode 필드가 없으면 HTTP 상태와 본문 전체를 사용")
    void initialize_fallsBackToHttpStatus() {
        // given
        server.expect(requestTo(URL))
                .andRespond(withStatus(HttpStatus.BAD_GATEWAY).body("upstream down"));

        // when
        GeneratorEnvelope envelope = client.initialize(Map.of());

        // then
        assertThat(envelope.statusCode()).isEqualTo(502);
        assertThat(envelope.body().asText()).isEqualTo("upstream down");
        assertThat(envelope.isGenerating()).isFalse();
    }
}
