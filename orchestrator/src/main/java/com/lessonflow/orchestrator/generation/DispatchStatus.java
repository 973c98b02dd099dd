package com.lessonflow.orchestrator.generation;

public enum DispatchStatus {
    /** 생성기가 이미 생성된 잡이라고 응답 (400) */
    ALREADY_DONE,
    /** 폴링 중 Generated=true 확인 */
    DONE,
    /** 시도 횟수 소진 또는 취소 */
    TIMEOUT,
    /** 200이지만 생성 중 신호가 아님 - 본문 그대로 전달 */
    UNEXPECTED,
    ERROR
}
