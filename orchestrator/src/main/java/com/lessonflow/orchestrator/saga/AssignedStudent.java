package com.lessonflow.orchestrator.saga;

import com.fasterxml.jackson.annotation.JsonProperty;

public record AssignedStudent(
        String email,
        @JsonProperty("student_id") String studentId
) {
}
