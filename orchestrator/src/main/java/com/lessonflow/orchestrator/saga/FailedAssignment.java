package com.lessonflow.orchestrator.saga;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * 배정 실패 학생
 *
 * 게이트웨이가 응답했지만 assigned가 아니면 resp, 예외였다면 error가 채워진다.
 * 학생 조회 단계에서 예외가 나면 studentId는 null.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record FailedAssignment(
        String email,
        @JsonProperty("student_id") String studentId,
        @JsonProperty("resp") JsonNode response,
        String error
) {
}
