package com.lessonflow.common.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * 오류 응답 정보
 *
 * detail은 어떤 단계/리소스가 실패했는지 알려주는 부가 정보 (재시도 대상 식별용)
 */
@Builder
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ErrorInfo {

    private String code;
    private String message;
    private String detail;

    public static ErrorInfo of(String code, String message) {
        return ErrorInfo.builder()
                .code(code)
                .message(message)
                .build();
    }

    public static ErrorInfo of(String code, String message, String detail) {
        return ErrorInfo.builder()
                .code(code)
                .message(message)
                .detail(detail)
                .build();
    }
}
