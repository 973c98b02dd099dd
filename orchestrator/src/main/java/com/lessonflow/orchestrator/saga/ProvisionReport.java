package com.lessonflow.orchestrator.saga;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * 프로비저닝 결과
 *
 * fatal=true: 레슨 레코드 생성 실패로 나머지 단계는 시도하지 않음
 * fatal=false이고 stepErrors가 있으면 부분 성공 (Degraded)
 */
public record ProvisionReport(
        @JsonProperty("uuid") String lessonUuid,
        @JsonProperty("subject_id") String subjectId,
        @JsonProperty("assigned_students") List<AssignedStudent> assignedStudents,
        @JsonProperty("not_found_students") List<String> notFoundStudents,
        @JsonProperty("failed_assignments") List<FailedAssignment> failedAssignments,
        @JsonProperty("linked_students") List<String> linkedStudents,
        @JsonProperty("step_errors") List<StepError> stepErrors,
        boolean fatal
) {

    public static ProvisionReport fatal(String lessonUuid, StepError error) {
        return new ProvisionReport(lessonUuid, null, List.of(), List.of(), List.of(), List.of(),
                List.of(error), true);
    }

    public boolean degraded() {
        return !fatal && !stepErrors.isEmpty();
    }
}
