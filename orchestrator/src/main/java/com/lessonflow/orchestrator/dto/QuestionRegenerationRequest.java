package com.lessonflow.orchestrator.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;

import java.util.Map;

/**
 * POST /api/ai/regenerate-question
 *
 * current_question은 대시보드가 들고 있는 문항 원본 (QuizQuestion과 같은 필드 이름)
 */
public record QuestionRegenerationRequest(
        @NotNull @JsonProperty("current_question") Map<String, Object> currentQuestion,
        @NotBlank @JsonProperty("edit_instruction") String editInstruction,
        @NotBlank String subject,
        @NotBlank String topic,
        @NotBlank @JsonProperty("grade_level") String gradeLevel,
        @NotBlank @Pattern(regexp = "easy|medium|hard") String difficulty
) {
}
