package com.lessonflow.orchestrator.generation;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * @param upstreamStatus UPSTREAM_ERROR: 생성기/함수 상태 코드 (응답 없이 실패하면 0), FORWARDED: 함수 statusCode
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record CourseGenerationOutcome(
        CourseGenerationStatus status,
        @JsonProperty("topic_id") String topicId,
        Integer upstreamStatus,
        String detail,
        JsonNode body
) {

    public static CourseGenerationOutcome alreadyExists(String topicId) {
        return new CourseGenerationOutcome(CourseGenerationStatus.ALREADY_EXISTS, topicId, null, null, null);
    }

    public static CourseGenerationOutcome stored(String topicId) {
        return new CourseGenerationOutcome(CourseGenerationStatus.STORED, topicId, null, null, null);
    }

    public static CourseGenerationOutcome upstreamError(String topicId, int status, String detail) {
        return new CourseGenerationOutcome(CourseGenerationStatus.UPSTREAM_ERROR, topicId, status, detail, null);
    }

    public static CourseGenerationOutcome malformed(String topicId, String detail) {
        return new CourseGenerationOutcome(CourseGenerationStatus.MALFORMED_UPSTREAM, topicId, null, detail, null);
    }

    public static CourseGenerationOutcome forwarded(String topicId, int statusCode, JsonNode body) {
        return new CourseGenerationOutcome(CourseGenerationStatus.FORWARDED, topicId, statusCode, null, body);
    }
}
