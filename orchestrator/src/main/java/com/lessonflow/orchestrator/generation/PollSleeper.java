package com.lessonflow.orchestrator.generation;

import java.time.Duration;

/**
 * 폴링 간 대기 (테스트에서는 실제로 잠들지 않는 구현으로 교체)
 */
@FunctionalInterface
public interface PollSleeper {

    void sleep(Duration interval) throws InterruptedException;
}
