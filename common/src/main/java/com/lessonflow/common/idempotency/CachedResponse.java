package com.lessonflow.common.idempotency;

import com.lessonflow.common.dto.ApiResponse;

/**
 * 캐시에 저장되는 응답 스냅샷 (상태 코드 + 본문)
 */
public record CachedResponse(int status, ApiResponse<Object> body) {
}
