package com.lessonflow.common.idempotency;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * 요청 단위 멱등성 보장 어노테이션
 *
 * 동일한 Idempotency Key로 다시 호출되면 워크플로우를 재실행하지 않고
 * 처음 응답(상태 코드 포함)을 그대로 돌려준다.
 * 대상 메서드는 {@code ResponseEntity<ApiResponse<?>>}를 반환해야 한다.
 *
 * @see <a href="https://datatracker.ietf.org/doc/draft-ietf-httpapi-idempotency-key-header/">IETF Idempotency-Key Header</a>
 */
@Target(ElementType.METHOD)
@Retention(RetentionPolicy.RUNTIME)
public @interface Idempotent {

    /**
     * Idempotency Key를 추출할 헤더 이름
     */
    String headerName() default "X-Idempotency-Key";

    /**
     * 캐시 유지 시간 (초), 기본 24시간
     */
    long ttlSeconds() default 86400;

    /**
     * Key prefix (Redis key 구분용)
     */
    String prefix() default "idempotency";

    /**
     * true: Key가 없으면 400
     * false: Key가 없으면 멱등성 체크 없이 실행 (기존 클라이언트 호환)
     */
    boolean required() default false;
}
