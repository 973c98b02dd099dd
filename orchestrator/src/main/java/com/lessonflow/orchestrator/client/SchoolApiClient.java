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
 * 학교 게이트웨이 클라이언트 (학교 조회, 과목 등록)
 *
 * Resilience4j 적용:
 * - @CircuitBreaker: 게이트웨이 장애 시 빠른 실패
 * - @Retry: 조회(resolveSchoolId)에만 적용, 과목 등록은 중복 insert 위험이 있어 재시도하지 않음
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class SchoolApiClient {

    static final String API_KEY_HEADER = "x-api-key";
    private static final String SERVICE = "school-api";

    private static final String CIRCUIT_BREAKER_NAME = "schoolApi";
    private static final String RETRY_NAME = "schoolApi";

    private final RestClient restClient;
    private final ObjectMapper objectMapper;
    private final LessonflowProperties properties;

    /**
     * 테넌트 이메일로 school_id 조회
     *
     * 응답: [{"school_id": ...}, ...] 첫 번째 항목 사용, 빈 본문이면 empty
     */
    @CircuitBreaker(name = CIRCUIT_BREAKER_NAME, fallbackMethod = "resolveSchoolIdFallback")
    @Retry(name = RETRY_NAME)
    public Optional<String> resolveSchoolId(String tenantEmail) {
        LessonflowProperties.Gateway gateway = properties.getGateway();

        RawResponse response = RawResponse.fetch(restClient.post()
                .uri(gateway.getSchoolLookupUrl())
                .header(API_KEY_HEADER, gateway.getApiKey())
                .contentType(MediaType.APPLICATION_JSON)
                .body(Map.of("email", tenantEmail)));

        if (!response.is2xx()) {
            throw new ExternalCallException(SERVICE, response.status(), response.snippet());
        }

        Optional<String> schoolId = response.json(objectMapper)
                .filter(JsonNode::isArray)
                .filter(array -> !array.isEmpty())
                .map(array -> array.get(0).path("school_id"))
                .filter(node -> !node.isMissingNode() && !node.isNull())
                .map(JsonNode::asText);

        log.info("학교 조회: tenantEmail={}, schoolId={}", tenantEmail, schoolId.orElse(null));
        return schoolId;
    }

    private Optional<String> resolveSchoolIdFallback(String tenantEmail, Exception ex) {
        log.error("[Fallback] 학교 조회 실패 - tenantEmail={}, 원인: {}", tenantEmail, ex.getMessage());
        throw new BusinessException(ErrorCode.SERVICE_UNAVAILABLE, SERVICE + ": " + ex.getMessage(), ex);
    }

    /**
     * 과목 등록
     *
     * @return inserted_subject_id, 200이지만 본문에 id가 없으면 empty
     */
    @CircuitBreaker(name = CIRCUIT_BREAKER_NAME, fallbackMethod = "insertSubjectFallback")
    public Optional<String> insertSubject(SubjectRegistration registration) {
        LessonflowProperties.Gateway gateway = properties.getGateway();

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("name", registration.name());
        payload.put("grade", registration.grade());
        payload.put("section", registration.section());
        payload.put("school_id", registration.schoolId());
        payload.put("period", registration.period());

        RawResponse response = RawResponse.fetch(restClient.post()
                .uri(gateway.getSubjectInsertUrl())
                .header(API_KEY_HEADER, gateway.getApiKey())
                .contentType(MediaType.APPLICATION_JSON)
                .body(payload));
        log.info("[Insert Subject API] status={}, response={}", response.status(), response.snippet());

        if (!response.isOk()) {
            throw new ExternalCallException(SERVICE, response.status(), response.snippet());
        }

        return response.json(objectMapper)
                .map(body -> body.path("inserted_subject_id"))
                .filter(node -> !node.isMissingNode() && !node.isNull())
                .map(JsonNode::asText);
    }

    private Optional<String> insertSubjectFallback(SubjectRegistration registration, Exception ex) {
        log.error("[Fallback] 과목 등록 실패 - name={}, 원인: {}", registration.name(), ex.getMessage());
        throw new BusinessException(ErrorCode.SERVICE_UNAVAILABLE, SERVICE + ": " + ex.getMessage(), ex);
    }
}
