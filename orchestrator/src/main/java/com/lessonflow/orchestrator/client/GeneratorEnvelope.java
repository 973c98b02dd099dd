package com.lessonflow.orchestrator.client;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * 생성기 응답 Envelope {statusCode, body}
 *
 * statusCode는 분기 기준이다 (400: 이미 생성됨, 200: 생성 중 또는 즉시 결과).
 */
public record GeneratorEnvelope(int statusCode, JsonNode body) {

    public boolean isGenerating() {
        return statusCode == 200
                && body != null
                && body.path("generating").isBoolean()
                && body.path("generating").booleanValue()
                && body.hasNonNull("id");
    }

    public String jobId() {
        return body == null ? null : body.path("id").asText(null);
    }
}
