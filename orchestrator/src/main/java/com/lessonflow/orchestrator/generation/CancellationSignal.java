package com.lessonflow.orchestrator.generation;

import java.time.Clock;
import java.time.Instant;

/**
 * 폴링 중단 신호
 *
 * 매 시도 전후로 확인한다. 스레드 인터럽트는 별도로 처리된다.
 */
@FunctionalInterface
public interface CancellationSignal {

    boolean isCancelled();

    static CancellationSignal none() {
        return () -> false;
    }

    /**
     * 요청 마감 시각이 지나면 취소
     */
    static CancellationSignal deadline(Clock clock, Instant deadline) {
        return () -> !clock.instant().isBefore(deadline);
    }
}
