package com.lessonflow.common.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * 공통 응답 Envelope
 *
 * 워크플로우가 일부만 성공한 경우(예: 레코드 생성 실패 리포트)에는
 * success=false 이면서 data에 상세 결과를 함께 담는다.
 */
@Builder
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ApiResponse<T> {

    private boolean success;
    private T data;
    private ErrorInfo errorInfo;

    public static <T> ApiResponse<T> success(T data) {
        return ApiResponse.<T>builder()
                .success(true)
                .data(data)
                .build();
    }

    public static <T> ApiResponse<T> fail(String code, String message) {
        return ApiResponse.<T>builder()
                .success(false)
                .errorInfo(ErrorInfo.of(code, message))
                .build();
    }

    public static <T> ApiResponse<T> fail(ErrorInfo errorInfo) {
        return ApiResponse.<T>builder()
                .success(false)
                .errorInfo(errorInfo)
                .build();
    }

    public static <T> ApiResponse<T> fail(ErrorInfo errorInfo, T data) {
        return ApiResponse.<T>builder()
                .success(false)
                .data(data)
                .errorInfo(errorInfo)
                .build();
    }
}
