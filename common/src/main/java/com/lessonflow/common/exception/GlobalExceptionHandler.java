package com.lessonflow.common.exception;

import com.lessonflow.common.dto.ApiResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.stream.Collectors;

/**
 * 전역 예외 처리기
 *
 * <h2>예외 분류</h2>
 * <pre>
 * 1. BusinessException: ErrorCode에 정의된 HTTP 상태로 응답
 *    - ResourceNotFoundException → 404
 *    - 외부 서비스/저장소 장애 코드 → 502/503
 *    - 입력 오류 → 400
 *
 * 2. 요청 본문 오류 (검증 실패, JSON 파싱 실패) → 400 INVALID_INPUT
 *
 * 3. OptimisticLockingFailureException → 409
 *    - 학생 subject_list 조건부 쓰기가 재시도 후에도 충돌한 경우
 *
 * 4. 기타 Exception → 500 (메시지 비노출)
 * </pre>
 *
 * 워크플로우의 부분 실패(Degraded)는 예외가 아니라 결과 리포트로 전달되므로 여기까지 오지 않는다.
 */
@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    @ExceptionHandler(BusinessException.class)
    public ResponseEntity<ApiResponse<Void>> handleBusinessException(BusinessException e) {
        ErrorCode errorCode = e.getErrorCode();
        if (errorCode.getStatus().is5xxServerError()) {
            log.error("비즈니스 예외 발생: code={}, message={}", errorCode.getCode(), e.getMessage(), e);
        } else {
            log.warn("비즈니스 예외 발생: code={}, message={}", errorCode.getCode(), e.getMessage());
        }

        return ResponseEntity
                .status(errorCode.getStatus())
                .body(ApiResponse.fail(e.getErrorInfo()));
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ApiResponse<Void>> handleValidationException(MethodArgumentNotValidException e) {
        String detail = e.getBindingResult().getFieldErrors().stream()
                .map(FieldError::getField)
                .collect(Collectors.joining(","));
        log.warn("요청 검증 실패: fields={}", detail);

        return ResponseEntity
                .status(HttpStatus.BAD_REQUEST)
                .body(ApiResponse.fail(ErrorCode.INVALID_INPUT.toErrorInfo(detail)));
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ApiResponse<Void>> handleNotReadable(HttpMessageNotReadableException e) {
        log.warn("요청 본문 파싱 실패: {}", e.getMessage());

        return ResponseEntity
                .status(HttpStatus.BAD_REQUEST)
                .body(ApiResponse.fail(ErrorCode.INVALID_INPUT.toErrorInfo()));
    }

    /**
     * 조건부 쓰기 충돌 (409 Conflict)
     * <p>
     * 클라이언트는 이 응답을 받으면 재시도해야 합니다.
     */
    @ExceptionHandler(OptimisticLockingFailureException.class)
    public ResponseEntity<ApiResponse<Void>> handleOptimisticLockException(
            OptimisticLockingFailureException e) {
        log.warn("조건부 쓰기 충돌 발생: {}", e.getMessage());

        return ResponseEntity
                .status(HttpStatus.CONFLICT)
                .body(ApiResponse.fail(ErrorCode.CONCURRENT_MODIFICATION.toErrorInfo()));
    }

    /**
     * 기타 모든 예외 처리 (500 Internal Server Error)
     * <p>
     * 예외 메시지를 클라이언트에 노출하지 않는다.
     */
    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiResponse<Void>> handleException(Exception e) {
        log.error("예외 발생: ", e);

        return ResponseEntity
                .status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(ApiResponse.fail(ErrorCode.INTERNAL_ERROR.toErrorInfo()));
    }
}
