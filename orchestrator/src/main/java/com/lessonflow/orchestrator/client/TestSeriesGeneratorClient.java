package com.lessonflow.orchestrator.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.TextNode;
import com.lessonflow.orchestrator.config.LessonflowProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;

import java.util.Map;
import java.util.Optional;

/**
 * 테스트 시리즈(ITP) 생성기 클라이언트
 *
 * 초기화 호출은 중복 생성 위험이 있어 재시도하지 않는다.
 * 전송 실패는 RestClientException 그대로 전파.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class TestSeriesGeneratorClient {

    private final RestClient restClient;
    private final ObjectMapper objectMapper;
    private final LessonflowProperties properties;

    /**
     * 생성 요청
     *
     * 생성기는 HTTP 200 본문 안에 {statusCode, body}를 담아 돌려준다.
     * statusCode 필드가 없으면 HTTP 상태와 본문 전체를 Envelope로 쓴다.
     */
    public GeneratorEnvelope initialize(Map<String, Object> payload) {
        log.info("[ITP Initialize] 요청: user_id={}", payload.get("user_id"));

        RawResponse response = RawResponse.fetch(restClient.post()
                .uri(properties.getGenerator().getTestSeriesInitializeUrl())
                .contentType(MediaType.APPLICATION_JSON)
                .body(payload));
        log.info("[ITP Initialize] status={}, response={}", response.status(), response.snippet());

        Optional<JsonNode> json = response.json(objectMapper);
        if (json.isPresent() && json.get().path("statusCode").canConvertToInt()) {
            JsonNode envelope = json.get();
            return new GeneratorEnvelope(envelope.path("statusCode").intValue(), unwrapBody(envelope.get("body")));
        }

        JsonNode body = json.orElseGet(() -> response.hasBody() ? TextNode.valueOf(response.body()) : null);
        return new GeneratorEnvelope(response.status(), body);
    }

    /**
     * body가 JSON 문자열로 한 번 더 감싸져 오는 경우 풀어서 반환
     */
    private JsonNode unwrapBody(JsonNode body) {
        if (body == null || !body.isTextual()) {
            return body;
        }
        return new RawResponse(200, body.asText()).json(objectMapper).orElse(body);
    }
}
