package com.lessonflow.orchestrator.generation;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record TestSeriesStatusView(
        String id,
        JobState state,
        @JsonProperty("series_title") String title,
        String detail
) {
}
