package com.lessonflow.orchestrator.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.lessonflow.common.exception.BusinessException;
import com.lessonflow.common.exception.ErrorCode;
import com.lessonflow.orchestrator.config.LessonflowProperties;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 퀴즈 문항 생성 LLM 클라이언트 (OpenAI 호환 chat completions)
 *
 * JSON 모드로 호출하고 첫 번째 choice의 message.content 원문을 돌려준다.
 * 문항 구조 해석/검증은 호출한 서비스가 한다.
 *
 * Resilience4j 적용:
 * - @CircuitBreaker만 적용, 호출마다 비용이 드는 생성 호출이라 재시도하지 않음
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class QuestionGeneratorClient {

    private static final String SERVICE = "question-generator";
    private static final String CIRCUIT_BREAKER_NAME = "questionGenerator";

    private final RestClient restClient;
    private final ObjectMapper objectMapper;
    private final LessonflowProperties properties;

    /**
     * @return message.content, 2xx지만 content가 없으면 empty
     */
    @CircuitBreaker(name = CIRCUIT_BREAKER_NAME, fallbackMethod = "completeFallback")
    public Optional<String> complete(String systemPrompt, String userPrompt) {
        LessonflowProperties.QuestionGenerator generator = properties.getQuestionGenerator();

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("model", generator.getModel());
        payload.put("messages", List.of(
                Map.of("role", "system", "content", systemPrompt),
                Map.of("role", "user", "content", userPrompt)));
        payload.put("response_format", Map.of("type", "json_object"));

        RawResponse response = RawResponse.fetch(restClient.post()
                .uri(generator.getUrl())
                .header(HttpHeaders.AUTHORIZATION, "Bearer " + generator.getApiKey())
                .contentType(MediaType.APPLICATION_JSON)
                .body(payload));
        log.info("[Question] LLM status={}", response.status());

        if (!response.is2xx()) {
            throw new ExternalCallException(SERVICE, response.status(), response.snippet());
        }

        return response.json(objectMapper)
                .map(body -> body.path("choices").path(0).path("message").path("content"))
                .filter(JsonNode::isTextual)
                .map(JsonNode::asText);
    }

    private Optional<String> completeFallback(String systemPrompt, String userPrompt, Exception ex) {
        log.error("[Fallback] 문항 생성 호출 실패 - 원인: {}", ex.getMessage());
        throw new BusinessException(ErrorCode.GENERATION_UPSTREAM_ERROR, SERVICE + ": " + ex.getMessage(), ex);
    }
}
