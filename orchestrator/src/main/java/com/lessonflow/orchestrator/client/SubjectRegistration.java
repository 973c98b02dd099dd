package com.lessonflow.orchestrator.client;

/**
 * 학교 게이트웨이 과목 등록 요청
 */
public record SubjectRegistration(
        String name,
        String grade,
        String section,
        String period,
        String schoolId
) {
}
