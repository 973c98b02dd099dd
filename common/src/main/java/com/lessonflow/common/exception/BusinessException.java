package com.lessonflow.common.exception;

import com.lessonflow.common.dto.ErrorInfo;
import lombok.Getter;

/**
 * 워크플로우 경계에서 변환된 도메인 예외
 *
 * 어댑터 예외는 이 타입(또는 하위 타입)으로 감싸서만 워크플로우 밖으로 나간다.
 */
@Getter
public class BusinessException extends RuntimeException {
    private final ErrorCode errorCode;
    private final String detail;

    public BusinessException(ErrorCode errorCode) {
        super(errorCode.getMessage());
        this.errorCode = errorCode;
        this.detail = null;
    }

    public BusinessException(ErrorCode errorCode, String detail) {
        super(errorCode.getMessage() + ": " + detail);
        this.errorCode = errorCode;
        this.detail = detail;
    }

    public BusinessException(ErrorCode errorCode, String detail, Throwable cause) {
        super(errorCode.getMessage() + ": " + detail, cause);
        this.errorCode = errorCode;
        this.detail = detail;
    }

    public ErrorInfo getErrorInfo() {
        return detail == null ? errorCode.toErrorInfo() : errorCode.toErrorInfo(detail);
    }
}
