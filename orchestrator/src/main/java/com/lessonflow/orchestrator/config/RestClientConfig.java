package com.lessonflow.orchestrator.config;

import com.lessonflow.common.logging.RequestIdFilter;
import org.slf4j.MDC;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.JdkClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

import java.net.http.HttpClient;
import java.time.Duration;

@Configuration
public class RestClientConfig {

    /**
     * 공통 RestClient
     *
     * - MDC의 traceId를 X-Request-ID 헤더로 전파
     * - read timeout은 가장 긴 호출(코스 생성) 기준
     */
    @Bean
    public RestClient restClient(RestClient.Builder builder, LessonflowProperties properties) {
        HttpClient httpClient = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(10))
                .build();
        JdkClientHttpRequestFactory requestFactory = new JdkClientHttpRequestFactory(httpClient);
        requestFactory.setReadTimeout(properties.getGenerator().getReadTimeout());

        return builder
                .requestFactory(requestFactory)
                .requestInterceptor((request, body, execution) -> {
                    String traceId = MDC.get(RequestIdFilter.MDC_TRACE_ID);
                    if (traceId != null) {
                        request.getHeaders().add(RequestIdFilter.REQUEST_ID_HEADER, traceId);
                    }
                    return execution.execute(request, body);
                })
                .build();
    }
}
