package com.lessonflow.orchestrator.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;

/**
 * POST /api/ai/generate-question
 */
public record QuestionGenerationRequest(
        @NotBlank String subject,
        @NotBlank String topic,
        String subtopic,
        @NotBlank @JsonProperty("grade_level") String gradeLevel,
        @NotBlank @Pattern(regexp = "easy|medium|hard") String difficulty,
        @JsonProperty("learning_style") String learningStyle,
        @JsonProperty("additional_context") String additionalContext
) {
}
