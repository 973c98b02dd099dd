package com.lessonflow.common.exception;


import com.lessonflow.common.dto.ErrorInfo;
import lombok.AllArgsConstructor;
import lombok.Getter;
import org.springframework.http.HttpStatus;

@Getter
@AllArgsConstructor
public enum ErrorCode {
    // ========================================
    // 공통
    // ========================================
    INVALID_INPUT("COMMON_001", "잘못된 입력입니다", HttpStatus.BAD_REQUEST),
    INTERNAL_ERROR("COMMON_002", "내부 서버 오류가 발생했습니다", HttpStatus.INTERNAL_SERVER_ERROR),
    IDEMPOTENCY_KEY_REQUIRED("COMMON_003", "Idempotency Key가 필요합니다", HttpStatus.BAD_REQUEST),
    IDEMPOTENT_REQUEST_IN_PROGRESS("COMMON_004", "동일한 요청이 처리 중입니다. 잠시 후 다시 시도해주세요.", HttpStatus.CONFLICT),

    // ========================================
    // 인프라/시스템 (외부 서비스 통신, 저장소)
    // ========================================
    /** 외부 게이트웨이 일시 장애 (Fallback) */
    SERVICE_UNAVAILABLE("INFRA_001", "서비스가 일시적으로 불안정합니다. 잠시 후 다시 시도해주세요.", HttpStatus.SERVICE_UNAVAILABLE),

    /** DynamoDB 읽기/쓰기 실패 */
    STORE_UNAVAILABLE("INFRA_002", "저장소에 접근할 수 없습니다. 잠시 후 다시 시도해주세요.", HttpStatus.BAD_GATEWAY),

    /** 조건부 쓰기 충돌 - 재시도 후에도 실패 */
    CONCURRENT_MODIFICATION("INFRA_003", "다른 요청이 먼저 처리되었습니다. 다시 시도해주세요.", HttpStatus.CONFLICT),

    // ========================================
    // 레슨 프로비저닝
    // ========================================
    LESSON_RECORD_CREATE_FAILED("LESSON_001", "레슨 레코드 생성에 실패했습니다", HttpStatus.BAD_GATEWAY),
    SUBJECT_NOT_FOUND("LESSON_002", "과목을 찾을 수 없습니다", HttpStatus.NOT_FOUND),

    // ========================================
    // 생성 (테스트 시리즈 / 코스)
    // ========================================
    GENERATION_UPSTREAM_ERROR("GENERATION_002", "생성 서비스가 오류를 반환했습니다", HttpStatus.BAD_GATEWAY),
    GENERATION_MALFORMED_RESPONSE("GENERATION_003", "생성 서비스 응답 형식이 올바르지 않습니다", HttpStatus.BAD_GATEWAY),
    TEST_SERIES_NOT_FOUND("GENERATION_004", "테스트 시리즈를 찾을 수 없습니다", HttpStatus.NOT_FOUND),
    TEST_SERIES_ALREADY_GENERATED("GENERATION_005", "이미 생성된 테스트 시리즈입니다", HttpStatus.BAD_REQUEST),
    /** Generated 플래그 없음 또는 상태 조회 실패 */
    TEST_SERIES_STATE_UNKNOWN("GENERATION_006", "테스트 시리즈 상태를 확인할 수 없습니다", HttpStatus.BAD_GATEWAY),
    ;

    private final String code;
    private final String message;
    private final HttpStatus status;

    public ErrorInfo toErrorInfo() {
        return ErrorInfo.of(this.code, this.message);
    }

    public ErrorInfo toErrorInfo(String detail) {
        return ErrorInfo.of(this.code, this.message, detail);
    }
}
