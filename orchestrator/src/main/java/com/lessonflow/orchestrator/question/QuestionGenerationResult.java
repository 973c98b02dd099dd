package com.lessonflow.orchestrator.question;

public record QuestionGenerationResult(QuizQuestion question) {
}
