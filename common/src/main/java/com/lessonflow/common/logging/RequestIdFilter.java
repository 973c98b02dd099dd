package com.lessonflow.common.logging;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.MDC;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.UUID;

/**
 * 요청별 traceId를 MDC에 설정하는 필터
 *
 * 동작:
 * 1. X-Request-ID 헤더가 있으면 → 해당 값 사용 (업스트림에서 전파)
 * 2. 없으면 → 새로 생성 (최초 진입점)
 *
 * MDC 키:
 * - traceId: 요청 추적 ID (X-Request-ID 헤더와 매핑)
 * - workflowId: 워크플로우가 실행 중 직접 설정 (레슨 UUID, 잡 ID 등)
 */
@Order(Ordered.HIGHEST_PRECEDENCE)
public class RequestIdFilter extends OncePerRequestFilter {

    public static final String REQUEST_ID_HEADER = "X-Request-ID";
    public static final String MDC_TRACE_ID = "traceId";
    public static final String MDC_WORKFLOW_ID = "workflowId";

    @Override
    protected void doFilterInternal(HttpServletRequest request,
                                    HttpServletResponse response,
                                    FilterChain filterChain) throws ServletException, IOException {
        try {
            String traceId = request.getHeader(REQUEST_ID_HEADER);
            if (traceId == null || traceId.isBlank()) {
                traceId = generateTraceId();
            }
            MDC.put(MDC_TRACE_ID, traceId);

            response.setHeader(REQUEST_ID_HEADER, traceId);

            filterChain.doFilter(request, response);
        } finally {
            // 워크플로우가 넣은 workflowId까지 함께 정리
            MDC.clear();
        }
    }

    private String generateTraceId() {
        return "REQ-" + UUID.randomUUID().toString().substring(0, 8).toUpperCase();
    }
}
