package com.lessonflow.orchestrator.generation;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.lessonflow.common.exception.BusinessException;
import com.lessonflow.common.exception.ErrorCode;
import com.lessonflow.common.exception.ResourceNotFoundException;
import com.lessonflow.common.logging.RequestIdFilter;
import com.lessonflow.orchestrator.client.CourseGeneratorClient;
import com.lessonflow.orchestrator.client.ExternalCallException;
import com.lessonflow.orchestrator.client.FunctionResult;
import com.lessonflow.orchestrator.client.ModuleFunctionInvoker;
import com.lessonflow.orchestrator.client.RawResponse;
import com.lessonflow.orchestrator.config.LessonflowProperties;
import com.lessonflow.orchestrator.dto.CourseGenerationRequest;
import com.lessonflow.orchestrator.store.CourseGenerationStore;
import com.lessonflow.orchestrator.store.LessonRecordStore;
import com.lessonflow.orchestrator.store.item.CourseGenerationItem;
import com.lessonflow.orchestrator.store.item.LessonRecordItem;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * 코스 생성 (중복 생성 방지)
 *
 * <pre>
 * 1. 소유자 결정: 요청 tenantEmail, 없으면 subject_id 레슨 레코드의 tenantEmail
 * 2. (소유자 소문자, topic_id) 결과가 있으면 ALREADY_EXISTS (생성기 호출 안 함)
 * 3. 생성기 호출: 비2xx/전송 실패 → UPSTREAM_ERROR, course 없음 → MALFORMED_UPSTREAM (저장 안 함)
 * 4. 조건부 저장 → STORED (동시 요청이 먼저 저장했으면 ALREADY_EXISTS)
 * </pre>
 *
 * 저장소 장애는 결과 상태가 아니라 BusinessException(STORE_UNAVAILABLE)으로 전파된다.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CourseGenerationWorkflow {

    static final String MODULE_TYPE = "ICP";

    private final LessonRecordStore lessonRecordStore;
    private final CourseGenerationStore courseGenerationStore;
    private final CourseGeneratorClient generatorClient;
    private final ModuleFunctionInvoker moduleFunctionInvoker;
    private final ObjectMapper objectMapper;
    private final LessonflowProperties properties;
    private final Clock clock;

    public CourseGenerationOutcome generateOrFetch(CourseGenerationRequest request) {
        String topicId = request.topicId();
        MDC.put(RequestIdFilter.MDC_WORKFLOW_ID, topicId);
        try {
            String owner = resolveOwner(request).toLowerCase(Locale.ROOT);

            if (exists(owner, topicId)) {
                log.info("[ICP] 이미 생성됨: owner={}, topicId={}", owner, topicId);
                return CourseGenerationOutcome.alreadyExists(topicId);
            }

            GeneratedCourse generated = callGenerator(request);
            if (generated.failure() != null) {
                return generated.failure();
            }

            CourseGenerationItem item = CourseGenerationItem.builder()
                    .email(owner)
                    .topicId(topicId)
                    .subjectId(request.subjectId())
                    .course(generated.course().isTextual() ? generated.course().asText() : generated.course().toString())
                    .env(properties.getEnvironment())
                    .createdAt(clock.instant().toString())
                    .build();

            if (!saveIfAbsent(item)) {
                return CourseGenerationOutcome.alreadyExists(topicId);
            }

            log.info("[ICP] 생성 결과 저장 완료: owner={}, topicId={}", owner, topicId);
            return CourseGenerationOutcome.stored(topicId);
        } finally {
            MDC.remove(RequestIdFilter.MDC_WORKFLOW_ID);
        }
    }

    /**
     * 공용(predefined) 코스 생성
     *
     * 중복 확인 없이 생성 결과를 모듈 생성 함수로 넘기고, 함수의 {statusCode, body}를 그대로 돌려준다.
     */
    public CourseGenerationOutcome generatePredefined(CourseGenerationRequest request) {
        String topicId = request.topicId();
        MDC.put(RequestIdFilter.MDC_WORKFLOW_ID, topicId);
        try {
            String owner = resolveOwner(request);

            GeneratedCourse generated = callGenerator(request);
            if (generated.failure() != null) {
                return generated.failure();
            }

            Map<String, Object> moduleBody = new LinkedHashMap<>();
            moduleBody.put("module", MODULE_TYPE);
            moduleBody.put("body", generated.course());
            moduleBody.put("env", properties.getEnvironment());
            moduleBody.put("subject_id", request.subjectId());
            moduleBody.put("topic_id", topicId);

            Map<String, Object> payload = new LinkedHashMap<>();
            payload.put("user_id", owner);
            payload.put("body", moduleBody);

            FunctionResult result;
            try {
                result = moduleFunctionInvoker.invoke(payload);
            } catch (ExternalCallException e) {
                log.error("[ICP] 모듈 생성 함수 실패: {}", e.getMessage());
                return CourseGenerationOutcome.upstreamError(topicId, e.getStatus(), e.getMessage());
            }

            log.info("[ICP] 모듈 생성 함수 응답: statusCode={}", result.statusCode());
            return CourseGenerationOutcome.forwarded(topicId, result.statusCode(), result.body());
        } finally {
            MDC.remove(RequestIdFilter.MDC_WORKFLOW_ID);
        }
    }

    private String resolveOwner(CourseGenerationRequest request) {
        if (request.tenantEmail() != null && !request.tenantEmail().isBlank()) {
            return request.tenantEmail();
        }

        Optional<LessonRecordItem> lesson;
        try {
            lesson = lessonRecordStore.findById(request.subjectId());
        } catch (Exception e) {
            throw new BusinessException(ErrorCode.STORE_UNAVAILABLE, e.getMessage(), e);
        }

        return lesson.map(LessonRecordItem::getTenantEmail)
                .filter(email -> !email.isBlank())
                .orElseThrow(() -> new ResourceNotFoundException(ErrorCode.SUBJECT_NOT_FOUND, request.subjectId()));
    }

    private boolean exists(String owner, String topicId) {
        try {
            return courseGenerationStore.exists(owner, topicId);
        } catch (Exception e) {
            throw new BusinessException(ErrorCode.STORE_UNAVAILABLE, e.getMessage(), e);
        }
    }

    private boolean saveIfAbsent(CourseGenerationItem item) {
        try {
            return courseGenerationStore.saveIfAbsent(item);
        } catch (Exception e) {
            throw new BusinessException(ErrorCode.STORE_UNAVAILABLE, e.getMessage(), e);
        }
    }

    private GeneratedCourse callGenerator(CourseGenerationRequest request) {
        String topicId = request.topicId();

        RawResponse response;
        try {
            response = generatorClient.generate(request.toGeneratorPayload());
        } catch (Exception e) {
            log.error("[ICP] 생성기 호출 실패: {}", e.getMessage());
            return GeneratedCourse.failed(CourseGenerationOutcome.upstreamError(topicId, 0, e.getMessage()));
        }

        if (!response.is2xx()) {
            return GeneratedCourse.failed(
                    CourseGenerationOutcome.upstreamError(topicId, response.status(), response.snippet()));
        }

        Optional<JsonNode> course = response.json(objectMapper)
                .map(body -> body.get("course"))
                .filter(node -> !node.isNull());
        if (course.isEmpty()) {
            log.warn("[ICP] 생성기 응답에 course 없음: {}", response.snippet());
            return GeneratedCourse.failed(
                    CourseGenerationOutcome.malformed(topicId, "course field missing in generator response"));
        }
        return GeneratedCourse.ok(course.get());
    }

    private record GeneratedCourse(JsonNode course, CourseGenerationOutcome failure) {

        static GeneratedCourse ok(JsonNode course) {
            return new GeneratedCourse(course, null);
        }

        static GeneratedCourse failed(CourseGenerationOutcome failure) {
            return new GeneratedCourse(null, failure);
        }
    }
}
