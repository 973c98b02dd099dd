package com.lessonflow.orchestrator.dto;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonAnySetter;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * POST /generate_itp
 *
 * 생성기 입력(시리즈 설정 등)은 해석하지 않고 extras로 받아 user_id, predefined와 함께 그대로 전달한다.
 * predefined=true면 공용 시리즈 테이블, false면 user_id 기준 사용자 시리즈 테이블을 폴링한다.
 */
@Getter
@Setter
@NoArgsConstructor
public class TestSeriesGenerationRequest {

    @JsonProperty("user_id")
    private String userId;

    private boolean predefined = true;

    private final Map<String, Object> extras = new LinkedHashMap<>();

    @JsonAnySetter
    public void putExtra(String name, Object value) {
        extras.put(name, value);
    }

    @JsonAnyGetter
    public Map<String, Object> getExtras() {
        return extras;
    }

    public Map<String, Object> toGeneratorPayload() {
        Map<String, Object> payload = new LinkedHashMap<>(extras);
        if (userId != null) {
            payload.put("user_id", userId);
        }
        payload.put("predefined", predefined);
        return payload;
    }
}
