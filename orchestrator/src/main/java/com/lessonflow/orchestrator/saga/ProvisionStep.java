package com.lessonflow.orchestrator.saga;

/**
 * 프로비저닝 단계 (실패 시 호출자가 해당 단계만 재시도할 수 있도록 리포트에 기록)
 */
public enum ProvisionStep {
    CREATE_LESSON_RECORD,
    REGISTER_SUBJECT,
    LINK_STUDENT_SUBJECTS,
    REGISTER_SUBJECT_TEACHER,
    PERSIST_LESSON_PLANNER
}
