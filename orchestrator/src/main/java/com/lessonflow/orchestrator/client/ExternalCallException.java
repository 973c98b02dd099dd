package com.lessonflow.orchestrator.client;

import lombok.Getter;

/**
 * 외부 서비스가 실패를 알린 경우 (비정상 상태 코드, 본문에 error 포함, Lambda functionError)
 *
 * 어댑터 레벨 예외이며 워크플로우 경계에서 단계 오류/결과 상태로 변환된다.
 * HTTP 응답 없이 실패한 경우 status는 0.
 */
@Getter
public class ExternalCallException extends RuntimeException {

    private final String service;
    private final int status;

    public ExternalCallException(String service, int status, String message) {
        super("[" + service + "] HTTP " + status + ": " + message);
        this.service = service;
        this.status = status;
    }

    public ExternalCallException(String service, String message, Throwable cause) {
        super("[" + service + "] " + message, cause);
        this.service = service;
        this.status = 0;
    }
}
