package com.lessonflow.common.exception;

import com.lessonflow.common.dto.ApiResponse;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import static org.assertj.core.api.Assertions.assertThat;

class GlobalExceptionHandlerTest {

    private final GlobalExceptionHandler handler = new GlobalExceptionHandler();

    @Test
    @DisplayName("BusinessException은 ErrorCode의 상태 코드와 detail을 그대로 쓴다")
    void businessException_usesErrorCodeStatus() {
        ResponseEntity<ApiResponse<Void>> response = handler.handleBusinessException(
                new BusinessException(ErrorCode.STORE_UNAVAILABLE, "dynamo down"));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_GATEWAY);
        assertThat(response.getBody().isSuccess()).isFalse();
        assertThat(response.getBody().getErrorInfo().getCode()).isEqualTo("INFRA_002");
        assertThat(response.getBody().getErrorInfo().getDetail()).isEqualTo("dynamo down");
    }

    @Test
    @DisplayName("ResourceNotFoundException → 404")
    void notFound() {
        ResponseEntity<ApiResponse<Void>> response = handler.handleBusinessException(
                new ResourceNotFoundException(ErrorCode.SUBJECT_NOT_FOUND, "subject-1"));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.NOT_FOUND);
    }

    @Test
    @DisplayName("조건부 쓰기 충돌 → 409")
    void optimisticLock_conflict() {
        ResponseEntity<ApiResponse<Void>> response = handler.handleOptimisticLockException(
                new OptimisticLockingFailureException("version mismatch"));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.CONFLICT);
        assertThat(response.getBody().getErrorInfo().getCode()).isEqualTo("INFRA_003");
    }

    @Test
    @DisplayName("그 외 예외 → 500, 메시지 비노출")
    void unexpected_hidesMessage() {
        ResponseEntity<ApiResponse<Void>> response = handler.handleException(new IllegalStateException("secret"));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.INTERNAL_SERVER_ERROR);
        assertThat(response.getBody().getErrorInfo().getMessage()).doesNotContain("secret");
    }
}
