package com.lessonflow.orchestrator.client;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.http.ResponseEntity;
import org.springframework.web.client.RestClient;

import java.util.Optional;

/**
 * 상태 코드와 본문 원문
 *
 * 게이트웨이는 성공 시에도 빈 본문이나 JSON이 아닌 본문을 돌려줄 수 있어
 * 상태 코드로 예외를 던지지 않고 원문을 그대로 받은 뒤 필요한 곳에서만 파싱한다.
 */
public record RawResponse(int status, String body) {

    private static final int SNIPPET_LENGTH = 500;

    static RawResponse fetch(RestClient.RequestHeadersSpec<?> request) {
        ResponseEntity<String> entity = request.retrieve()
                .onStatus(status -> true, (req, res) -> { })
                .toEntity(String.class);
        return new RawResponse(entity.getStatusCode().value(), entity.getBody());
    }

    public boolean isOk() {
        return status == 200;
    }

    public boolean is2xx() {
        return status >= 200 && status < 300;
    }

    public boolean hasBody() {
        return body != null && !body.isBlank();
    }

    /**
     * 본문이 비었거나 JSON이 아니면 empty
     */
    public Optional<JsonNode> json(ObjectMapper objectMapper) {
        if (!hasBody()) {
            return Optional.empty();
        }
        try {
            return Optional.of(objectMapper.readTree(body));
        } catch (JsonProcessingException e) {
            return Optional.empty();
        }
    }

    public String snippet() {
        if (body == null) {
            return "";
        }
        return body.length() <= SNIPPET_LENGTH ? body : body.substring(0, SNIPPET_LENGTH);
    }
}
