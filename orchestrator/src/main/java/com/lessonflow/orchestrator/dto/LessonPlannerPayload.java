package com.lessonflow.orchestrator.dto;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonAnySetter;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 레슨 플래너 payload
 *
 * 프로비저닝에 필요한 필드만 명시하고 나머지(계획 본문 등)는 extras에 그대로 보관한다.
 * 마지막 단계에서 payload 전체를 그대로 게이트웨이에 저장하므로 모르는 필드도 잃지 않아야 한다.
 */
@Getter
@Setter
@NoArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class LessonPlannerPayload {

    @NotBlank
    @JsonProperty("lesson_planner_UUID")
    private String lessonPlannerUuid;

    private String grade;

    private String section;

    private String period;

    @JsonProperty("teacher_id")
    private String teacherId;

    /** 학생 이메일 목록 */
    @JsonProperty("student")
    private List<String> students = new ArrayList<>();

    private final Map<String, Object> extras = new LinkedHashMap<>();

    @JsonAnySetter
    public void putExtra(String name, Object value) {
        extras.put(name, value);
    }

    @JsonAnyGetter
    public Map<String, Object> getExtras() {
        return extras;
    }

    public String gradeOrEmpty() {
        return grade == null ? "" : grade;
    }

    public String sectionOrEmpty() {
        return section == null ? "" : section;
    }

    public String periodOrEmpty() {
        return period == null ? "" : period;
    }

    public boolean hasTeacher() {
        return teacherId != null && !teacherId.isBlank();
    }
}
