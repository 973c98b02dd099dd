package com.lessonflow.orchestrator.config;

import com.lessonflow.orchestrator.support.PropertiesFixture;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.web.cors.CorsConfiguration;
import org.springframework.web.servlet.config.annotation.CorsRegistry;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class WebConfigTest {

    @Test
    @DisplayName("기본 설정이면 모든 출처에서 credentials와 함께 호출할 수 있다")
    void cors_allowsAnyOriginByDefault() {
        // given
        WebConfig webConfig = new WebConfig(PropertiesFixture.create());
        ExposedCorsRegistry registry = new ExposedCorsRegistry();

        // when
        webConfig.addCorsMappings(registry);

        // then
        CorsConfiguration cors = registry.configurations().get("/**");
        assertThat(cors).isNotNull();
        assertThat(cors.checkOrigin("https://dashboard.school.org")).isEqualTo("https://dashboard.school.org");
        assertThat(cors.getAllowCredentials()).isTrue();
        assertThat(cors.checkHttpMethod(HttpMethod.OPTIONS)).isNotNull();
        assertThat(cors.getExposedHeaders()).contains("X-Request-ID", "Idempotent-Replayed");
        assertThat(cors.getMaxAge()).isEqualTo(86400L);
    }

    @Test
    @DisplayName("출처 패턴을 지정하면 그 외 출처는 거부된다")
    void cors_restrictsToConfiguredPatterns() {
        // given
        LessonflowProperties properties = PropertiesFixture.create();
        properties.getCors().setAllowedOriginPatterns(List.of("https://*.school.org"));
        ExposedCorsRegistry registry = new ExposedCorsRegistry();

        // when
        new WebConfig(properties).addCorsMappings(registry);

        // then
        CorsConfiguration cors = registry.configurations().get("/**");
        assertThat(cors.checkOrigin("https://admin.school.org")).isEqualTo("https://admin.school.org");
        assertThat(cors.checkOrigin("https://evil.example.com")).isNull();
    }

    private static class ExposedCorsRegistry extends CorsRegistry {

        Map<String, CorsConfiguration> configurations() {
            return getCorsConfigurations();
        }
    }
}
