package com.lessonflow.orchestrator.generation;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * 생성 요청 + 폴링 결과
 *
 * @param body   ALREADY_DONE/UNEXPECTED일 때 생성기 응답 본문
 * @param detail ERROR일 때 원인
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record DispatchOutcome(
        DispatchStatus status,
        String jobId,
        String title,
        JsonNode body,
        String detail
) {

    public static DispatchOutcome alreadyDone(JsonNode body) {
        return new DispatchOutcome(DispatchStatus.ALREADY_DONE, null, null, body, null);
    }

    public static DispatchOutcome done(String jobId, String title) {
        return new DispatchOutcome(DispatchStatus.DONE, jobId, title, null, null);
    }

    public static DispatchOutcome timeout(String jobId) {
        return new DispatchOutcome(DispatchStatus.TIMEOUT, jobId, null, null, null);
    }

    public static DispatchOutcome unexpected(JsonNode body) {
        return new DispatchOutcome(DispatchStatus.UNEXPECTED, null, null, body, null);
    }

    public static DispatchOutcome error(String jobId, String detail) {
        return new DispatchOutcome(DispatchStatus.ERROR, jobId, null, null, detail);
    }
}
