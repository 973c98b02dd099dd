package com.lessonflow.orchestrator.client;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Lambda 응답 Envelope {statusCode, body}
 */
public record FunctionResult(int statusCode, JsonNode body) {
}
