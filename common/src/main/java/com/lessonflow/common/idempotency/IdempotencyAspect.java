package com.lessonflow.common.idempotency;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.lessonflow.common.dto.ApiResponse;
import com.lessonflow.common.exception.ErrorCode;
import jakarta.servlet.http.HttpServletRequest;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.aspectj.lang.ProceedingJoinPoint;
import org.aspectj.lang.annotation.Around;
import org.aspectj.lang.annotation.Aspect;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.context.request.RequestContextHolder;
import org.springframework.web.context.request.ServletRequestAttributes;

import java.util.Optional;

/**
 * @Idempotent 어노테이션 처리 AOP
 *
 * 흐름: Key 추출 → 캐시 확인 → PROCESSING 마킹 → 실행 → 응답 캐시
 * 2xx 응답만 캐시한다. 실행 중 예외가 나거나 2xx가 아닌 응답이면
 * 마커를 지워 같은 Key로 다시 시도할 수 있게 한다.
 */
@Aspect
@Component
@RequiredArgsConstructor
@Slf4j
public class IdempotencyAspect {

    public static final String REPLAYED_HEADER = "Idempotent-Replayed";

    private final IdempotencyService idempotencyService;
    private final ObjectMapper objectMapper;

    @Around("@annotation(idempotent)")
    public Object handleIdempotency(ProceedingJoinPoint joinPoint, Idempotent idempotent) throws
            Throwable {
        String idempotencyKey = extractIdempotencyKey(idempotent.headerName());

        if (idempotencyKey == null || idempotencyKey.isBlank()) {
            if (idempotent.required()) {
                log.warn("[Idempotency] 필수 Key 누락 - header: {}", idempotent.headerName());
                return ResponseEntity
                        .status(ErrorCode.IDEMPOTENCY_KEY_REQUIRED.getStatus())
                        .body(ApiResponse.fail(
                                ErrorCode.IDEMPOTENCY_KEY_REQUIRED.toErrorInfo(idempotent.headerName())));
            }
            log.debug("[Idempotency] Key 없음 - 일반 처리");
            return joinPoint.proceed();
        }

        String cacheKey = idempotencyService.buildKey(idempotent.prefix(), idempotencyKey);

        Optional<CachedResponse> cached = idempotencyService.getIfProcessed(cacheKey);
        if (cached.isPresent()) {
            log.info("[Idempotency] 중복 요청 감지 - key: {}", idempotencyKey);
            return replay(cached.get());
        }

        if (!idempotencyService.markAsProcessing(cacheKey, idempotent.ttlSeconds())) {
            // 처리 완료 직후일 수 있으므로 한 번 더 확인
            cached = idempotencyService.getIfProcessed(cacheKey);
            if (cached.isPresent()) {
                return replay(cached.get());
            }
            log.warn("[Idempotency] 동시 요청 감지 - key: {}", idempotencyKey);
            return ResponseEntity
                    .status(ErrorCode.IDEMPOTENT_REQUEST_IN_PROGRESS.getStatus())
                    .body(ApiResponse.fail(ErrorCode.IDEMPOTENT_REQUEST_IN_PROGRESS.toErrorInfo()));
        }

        Object result;
        try {
            result = joinPoint.proceed();
        } catch (Throwable t) {
            idempotencyService.release(cacheKey);
            throw t;
        }

        if (result instanceof ResponseEntity<?> entity) {
            if (entity.getStatusCode().is2xxSuccessful()) {
                idempotencyService.saveResponse(cacheKey, toCachedResponse(entity), idempotent.ttlSeconds());
            } else {
                // 실패 응답은 같은 Key로 재시도할 수 있어야 한다
                log.info("[Idempotency] 실패 응답 - 캐시 생략, 마커 해제: key={}, status={}",
                        idempotencyKey, entity.getStatusCode().value());
                idempotencyService.release(cacheKey);
            }
        } else {
            log.warn("[Idempotency] ResponseEntity가 아닌 반환 타입 - 캐시 생략: {}",
                    joinPoint.getSignature().toShortString());
            idempotencyService.release(cacheKey);
        }

        return result;
    }

    private CachedResponse toCachedResponse(ResponseEntity<?> entity) {
        ApiResponse<Object> body = entity.getBody() instanceof ApiResponse<?> apiResponse
                ? new ApiResponse<Object>(apiResponse.isSuccess(), apiResponse.getData(), apiResponse.getErrorInfo())
                : ApiResponse.success(objectMapper.convertValue(entity.getBody(), Object.class));
        return new CachedResponse(entity.getStatusCode().value(), body);
    }

    private ResponseEntity<ApiResponse<Object>> replay(CachedResponse cached) {
        return ResponseEntity
                .status(cached.status())
                .header(REPLAYED_HEADER, "true")
                .body(cached.body());
    }

    private String extractIdempotencyKey(String headerName) {
        ServletRequestAttributes attributes =
                (ServletRequestAttributes) RequestContextHolder.getRequestAttributes();

        if (attributes == null) {
            return null;
        }

        HttpServletRequest request = attributes.getRequest();
        return request.getHeader(headerName);
    }
}
