package com.lessonflow.common.idempotency;


import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.redisson.api.RBucket;
import org.redisson.api.RedissonClient;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Optional;

/**
 * Idempotency Key 관리 서비스
 * Redis(Redisson)를 사용하여 다중 인스턴스에서도 동작
 *
 * 값 형태:
 * - "PROCESSING": 최초 요청이 아직 실행 중
 * - CachedResponse JSON: 처리 완료된 응답
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class IdempotencyService {

    static final String PROCESSING = "PROCESSING";

    private final RedissonClient redissonClient;
    private final ObjectMapper objectMapper;

    /**
     * 이미 처리된 요청이면 캐시된 응답 반환
     */
    public Optional<CachedResponse> getIfProcessed(String key) {
        RBucket<String> bucket = redissonClient.getBucket(key);
        String cached = bucket.get();

        if (cached == null || PROCESSING.equals(cached)) {
            return Optional.empty();
        }

        try {
            log.info("[Idempotency] 캐시된 응답 반환 - key: {}", key);
            return Optional.of(objectMapper.readValue(cached, CachedResponse.class));
        } catch (JsonProcessingException e) {
            log.error("[Idempotency] 캐시 응답 역직렬화 실패 - key: {}", key, e);
            return Optional.empty();
        }
    }

    public void saveResponse(String key, CachedResponse response, long ttlSeconds) {
        try {
            String json = objectMapper.writeValueAsString(response);
            redissonClient.<String>getBucket(key).set(json, Duration.ofSeconds(ttlSeconds));
            log.info("[Idempotency] 응답 캐시 저장 - key: {}, status: {}, ttl: {}초",
                    key, response.status(), ttlSeconds);
        } catch (JsonProcessingException e) {
            // 캐시 실패는 응답 자체에 영향 없음, 마커만 해제해서 재요청이 막히지 않게 한다
            log.error("[Idempotency] 응답 직렬화 실패 - key: {}", key, e);
            release(key);
        }
    }

    /**
     * 처리 중 상태로 마킹
     * @return true: 마킹 성공 (첫 요청), false: 이미 처리 중이거나 처리 완료
     */
    public boolean markAsProcessing(String key, long ttlSeconds) {
        RBucket<String> bucket = redissonClient.getBucket(key);
        boolean success = bucket.setIfAbsent(PROCESSING, Duration.ofSeconds(ttlSeconds));

        if (success) {
            log.info("[Idempotency] 처리 시작 마킹 - key: {}", key);
        } else {
            log.warn("[Idempotency] 이미 등록된 요청 - key: {}", key);
        }

        return success;
    }

    /**
     * 처리 실패 시 마커 제거 (같은 키로 재시도 가능하도록)
     */
    public void release(String key) {
        redissonClient.getBucket(key).delete();
        log.info("[Idempotency] 처리 마커 해제 - key: {}", key);
    }

    public String buildKey(String prefix, String idempotencyKey) {
        return prefix + ":" + idempotencyKey;
    }
}
