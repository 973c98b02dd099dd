package com.lessonflow.orchestrator.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;

/**
 * POST /process_all
 *
 * tenantEmail/tenantName이 없으면 lessonflow.tenant.* 기본값 사용
 */
public record LessonProvisionRequest(
        String subject,
        String tenantEmail,
        String tenantName,
        @Valid @NotNull LessonPlannerPayload body
) {
    public LessonProvisionRequest {
        subject = subject == null ? "" : subject.strip();
    }
}
