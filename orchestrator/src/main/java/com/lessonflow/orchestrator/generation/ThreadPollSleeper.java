package com.lessonflow.orchestrator.generation;

import org.springframework.stereotype.Component;

import java.time.Duration;

@Component
public class ThreadPollSleeper implements PollSleeper {

    @Override
    public void sleep(Duration interval) throws InterruptedException {
        Thread.sleep(interval.toMillis());
    }
}
