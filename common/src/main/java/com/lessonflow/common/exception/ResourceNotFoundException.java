package com.lessonflow.common.exception;

/**
 * 조회 대상이 존재하지 않음 (404)
 */
public class ResourceNotFoundException extends BusinessException {

    public ResourceNotFoundException(ErrorCode errorCode, String detail) {
        super(errorCode, detail);
    }
}
