package com.lessonflow.orchestrator.client;

import com.lessonflow.orchestrator.config.LessonflowProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;

import java.util.Map;

/**
 * 코스(ICP) 생성기 클라이언트
 *
 * LLM 기반 생성이라 응답이 느리다 (read timeout: lessonflow.generator.read-timeout).
 * 상태 코드 해석은 호출한 워크플로우가 한다.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class CourseGeneratorClient {

    private final RestClient restClient;
    private final LessonflowProperties properties;

    public RawResponse generate(Map<String, Object> payload) {
        RawResponse response = RawResponse.fetch(restClient.post()
                .uri(properties.getGenerator().getCourseGenerateUrl())
                .contentType(MediaType.APPLICATION_JSON)
                .body(payload));
        log.info("[ICP] Generate API status={}, response={}", response.status(), response.snippet());
        return response;
    }
}
