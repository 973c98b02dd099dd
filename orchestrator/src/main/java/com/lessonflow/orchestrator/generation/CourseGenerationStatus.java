package com.lessonflow.orchestrator.generation;

public enum CourseGenerationStatus {
    /** (소유자, topic_id) 결과가 이미 있음 - 생성기 호출 없음 */
    ALREADY_EXISTS,
    STORED,
    UPSTREAM_ERROR,
    /** 2xx지만 course 필드 없음 또는 JSON 아님 */
    MALFORMED_UPSTREAM,
    /** 모듈 생성 함수 응답을 그대로 전달 (predefined) */
    FORWARDED
}
