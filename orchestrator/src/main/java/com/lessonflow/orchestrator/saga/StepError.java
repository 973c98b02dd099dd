package com.lessonflow.orchestrator.saga;

public record StepError(ProvisionStep step, String message) {
}
