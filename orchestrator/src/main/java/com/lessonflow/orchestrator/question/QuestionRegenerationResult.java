package com.lessonflow.orchestrator.question;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * @param changesSummary 기존 문항과 달라진 항목 설명
 */
public record QuestionRegenerationResult(
        @JsonProperty("regenerated_question") QuizQuestion regeneratedQuestion,
        @JsonProperty("changes_summary") List<String> changesSummary
) {
}
