package com.lessonflow.orchestrator.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * POST /generate_icp, /generate_icp/predefined
 *
 * tenantEmail이 없으면 subject_id 레슨 레코드의 tenantEmail을 소유자로 사용한다.
 */
public record CourseGenerationRequest(
        @NotBlank @JsonProperty("subject_id") String subjectId,
        @NotBlank @JsonProperty("topic_id") String topicId,
        String tenantEmail,
        @NotBlank String topic,
        @NotBlank String audience,
        @NotBlank @JsonProperty("icp_UUID") String icpUuid,
        @NotNull String description
) {

    public Map<String, Object> toGeneratorPayload() {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("topic", topic);
        payload.put("audience", audience);
        payload.put("icp_UUID", icpUuid);
        payload.put("description", description);
        return payload;
    }
}
