package com.lessonflow.orchestrator.linker;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * 일괄 연결 결과
 *
 * updated/alreadyLinked는 저장된 키, notFound는 요청에 들어온 키 그대로
 */
public record BulkLinkReport(
        @JsonProperty("lesson_planner_UUID") String lessonUuid,
        @JsonProperty("updated_students") List<String> updated,
        @JsonProperty("already_linked") List<String> alreadyLinked,
        @JsonProperty("not_found") List<String> notFound
) {
}
