package com.lessonflow.orchestrator.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;

import java.util.List;

/**
 * POST /update_student_subjects
 *
 * { "body": { "lesson_planner_UUID": "...", "student": ["a@x.com", ...] } }
 */
public record StudentSubjectLinkRequest(@Valid @NotNull Body body) {

    public record Body(
            @JsonProperty("lesson_planner_UUID") String lessonPlannerUuid,
            @JsonProperty("student") List<String> students
    ) {
    }
}
