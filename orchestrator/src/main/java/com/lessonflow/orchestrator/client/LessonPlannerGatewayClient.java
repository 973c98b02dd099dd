package com.lessonflow.orchestrator.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.lessonflow.common.exception.BusinessException;
import com.lessonflow.common.exception.ErrorCode;
import com.lessonflow.orchestrator.config.LessonflowProperties;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.github.resilience4j.retry.annotation.Retry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * 레슨 플래너 관계형 게이트웨이 클라이언트
 *
 * query_name 파라미터로 쿼리를 선택하는 API Gateway 엔드포인트.
 * 성공 응답도 빈 본문/비JSON일 수 있다.
 *
 * Resilience4j: 전 호출 @CircuitBreaker, 학생 조회만 @Retry
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class LessonPlannerGatewayClient {

    private static final String SERVICE = "lesson-planner-gateway";

    private static final String CIRCUIT_BREAKER_NAME = "lessonPlannerGateway";
    private static final String RETRY_NAME = "lessonPlannerGateway";

    static final String GET_STUDENT_BY_EMAIL = "get_student_by_email";
    static final String ASSIGN_SUBJECT_TO_STUDENT = "assign_subject_to_student";
    static final String INSERT_SUBJECT_TEACHER = "insert_subject_teacher";
    static final String INSERT_LESSON_PLANNER_PAYLOAD = "insert_lesson_planner_payload";

    private static final String ASSIGNED = "assigned";

    private final RestClient restClient;
    private final ObjectMapper objectMapper;
    private final LessonflowProperties properties;

    /**
     * 이메일로 student_id 조회
     */
    @CircuitBreaker(name = CIRCUIT_BREAKER_NAME, fallbackMethod = "findStudentIdFallback")
    @Retry(name = RETRY_NAME)
    public Optional<String> findStudentId(String email, int schoolId) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("email", email);
        payload.put("school_id", schoolId);

        RawResponse response = query(GET_STUDENT_BY_EMAIL, payload);
        log.info("[GET Student] status={}, response={}", response.status(), response.snippet());

        if (!response.isOk()) {
            return Optional.empty();
        }

        return response.json(objectMapper)
                .filter(JsonNode::isArray)
                .filter(array -> !array.isEmpty())
                .map(array -> array.get(0).path("student_id"))
                .filter(node -> !node.isMissingNode() && !node.isNull())
                .map(JsonNode::asText);
    }

    private Optional<String> findStudentIdFallback(String email, int schoolId, Exception ex) {
        log.error("[Fallback] 학생 조회 실패 - email={}, 원인: {}", email, ex.getMessage());
        throw new BusinessException(ErrorCode.SERVICE_UNAVAILABLE, SERVICE + ": " + ex.getMessage(), ex);
    }

    /**
     * 학생에게 과목 배정
     */
    @CircuitBreaker(name = CIRCUIT_BREAKER_NAME, fallbackMethod = "assignSubjectFallback")
    public AssignmentResult assignSubject(String studentId, String subjectId) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("student_id", studentId);
        payload.put("subject_id", subjectId);
        payload.put("assigned_level_id", "");
        payload.put("is_homeroom", "False");
        payload.put("school_year_id", "");

        RawResponse response = query(ASSIGN_SUBJECT_TO_STUDENT, payload);
        log.info("[Assign Subject] status={}, response={}", response.status(), response.snippet());

        JsonNode body = response.json(objectMapper).orElse(null);
        boolean assigned = body != null && ASSIGNED.equals(body.path("status").asText(null));
        return new AssignmentResult(assigned, body);
    }

    private AssignmentResult assignSubjectFallback(String studentId, String subjectId, Exception ex) {
        log.error("[Fallback] 과목 배정 실패 - studentId={}, subjectId={}, 원인: {}",
                studentId, subjectId, ex.getMessage());
        throw new BusinessException(ErrorCode.SERVICE_UNAVAILABLE, SERVICE + ": " + ex.getMessage(), ex);
    }

    /**
     * 과목-교사 관계 등록, 200이 아니면 실패
     */
    @CircuitBreaker(name = CIRCUIT_BREAKER_NAME, fallbackMethod = "insertSubjectTeacherFallback")
    public void insertSubjectTeacher(String subjectId, String teacherId) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("subject_id", subjectId);
        payload.put("teacher_id", teacherId);
        payload.put("role_id", "");
        payload.put("school_year", "");
        payload.put("school_year_id", "");

        RawResponse response = query(INSERT_SUBJECT_TEACHER, payload);
        log.info("[Subject-Teacher API] status={}, response={}", response.status(), response.snippet());

        if (!response.isOk()) {
            throw new ExternalCallException(SERVICE, response.status(), response.snippet());
        }
    }

    private void insertSubjectTeacherFallback(String subjectId, String teacherId, Exception ex) {
        log.error("[Fallback] 과목-교사 관계 등록 실패 - subjectId={}, teacherId={}, 원인: {}",
                subjectId, teacherId, ex.getMessage());
        throw new BusinessException(ErrorCode.SERVICE_UNAVAILABLE, SERVICE + ": " + ex.getMessage(), ex);
    }

    /**
     * 레슨 플래너 전체 payload 저장 ({"lesson_planner": payload})
     *
     * 200이어도 본문에 error가 있으면 실패로 본다. 비JSON 200은 성공.
     */
    @CircuitBreaker(name = CIRCUIT_BREAKER_NAME, fallbackMethod = "insertLessonPlannerFallback")
    public void insertLessonPlanner(Object lessonPlanner) {
        LessonflowProperties.Gateway gateway = properties.getGateway();

        RawResponse response = RawResponse.fetch(restClient.post()
                .uri(gateway.getInsertUrl() + "?query_name={queryName}", INSERT_LESSON_PLANNER_PAYLOAD)
                .header(SchoolApiClient.API_KEY_HEADER, gateway.getApiKey())
                .contentType(MediaType.APPLICATION_JSON)
                .body(Map.of("lesson_planner", lessonPlanner)));
        log.info("[Lesson Planner API] status={}, response={}", response.status(), response.snippet());

        if (!response.isOk()) {
            throw new ExternalCallException(SERVICE, response.status(), response.snippet());
        }

        boolean embeddedError = response.json(objectMapper)
                .filter(JsonNode::isObject)
                .map(body -> body.path("error"))
                .filter(error -> !error.isMissingNode() && !error.isNull()
                        && !(error.isBoolean() && !error.booleanValue())
                        && !(error.isTextual() && error.asText().isEmpty()))
                .isPresent();
        if (embeddedError) {
            throw new ExternalCallException(SERVICE, response.status(), response.snippet());
        }
    }

    private void insertLessonPlannerFallback(Object lessonPlanner, Exception ex) {
        log.error("[Fallback] 레슨 플래너 저장 실패 - 원인: {}", ex.getMessage());
        throw new BusinessException(ErrorCode.SERVICE_UNAVAILABLE, SERVICE + ": " + ex.getMessage(), ex);
    }

    private RawResponse query(String queryName, Map<String, Object> payload) {
        LessonflowProperties.Gateway gateway = properties.getGateway();
        return RawResponse.fetch(restClient.post()
                .uri(gateway.getQueryUrl() + "?query_name={queryName}", queryName)
                .header(SchoolApiClient.API_KEY_HEADER, gateway.getApiKey())
                .contentType(MediaType.APPLICATION_JSON)
                .body(payload));
    }
}
