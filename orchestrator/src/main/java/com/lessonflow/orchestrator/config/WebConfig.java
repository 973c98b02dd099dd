package com.lessonflow.orchestrator.config;

import com.lessonflow.common.idempotency.IdempotencyAspect;
import com.lessonflow.common.logging.RequestIdFilter;
import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.CorsRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

import java.time.Clock;

@Configuration
@RequiredArgsConstructor
public class WebConfig implements WebMvcConfigurer {

    private final LessonflowProperties properties;

    @Bean
    public RequestIdFilter requestIdFilter() {
        return new RequestIdFilter();
    }

    /**
     * 레코드 생성 시각, 폴링 마감 계산용 (테스트에서 고정 Clock으로 교체)
     */
    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /**
     * 모든 경로 CORS 허용 (출처 패턴: lessonflow.cors.*).
     * 추적/멱등성 헤더는 브라우저에 노출한다.
     */
    @Override
    public void addCorsMappings(CorsRegistry registry) {
        LessonflowProperties.Cors cors = properties.getCors();
        registry.addMapping("/**")
                .allowedOriginPatterns(cors.getAllowedOriginPatterns().toArray(String[]::new))
                .allowedMethods("GET", "POST", "PUT", "PATCH", "DELETE", "OPTIONS")
                .allowedHeaders("*")
                .exposedHeaders(RequestIdFilter.REQUEST_ID_HEADER, IdempotencyAspect.REPLAYED_HEADER)
                .allowCredentials(cors.isAllowCredentials())
                .maxAge(cors.getMaxAge().toSeconds());
    }
}
