package com.lessonflow.orchestrator.generation;

public enum JobState {
    GENERATED,
    GENERATING,
    /** Generated 플래그 없음 또는 조회 실패 */
    ERROR,
    NOT_FOUND
}
