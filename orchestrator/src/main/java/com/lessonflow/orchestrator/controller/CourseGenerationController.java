package com.lessonflow.orchestrator.controller;

import com.lessonflow.common.dto.ApiResponse;
import com.lessonflow.common.exception.ErrorCode;
import com.lessonflow.orchestrator.dto.CourseGenerationRequest;
import com.lessonflow.orchestrator.generation.CourseGenerationOutcome;
import com.lessonflow.orchestrator.generation.CourseGenerationWorkflow;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequiredArgsConstructor
@Slf4j
public class CourseGenerationController {

    private final CourseGenerationWorkflow workflow;

    /**
     * 코스 생성 (소유자+topic_id 당 한 번)
     *
     * POST /generate_icp
     * 200: 이미 생성됨, 201: 생성 후 저장, 404: 소유자 결정 불가, 502: 생성기 오류/응답 형식 오류
     */
    @PostMapping("/generate_icp")
    public ResponseEntity<ApiResponse<CourseGenerationOutcome>> generate(
            @Valid @RequestBody CourseGenerationRequest request) {
        log.info("코스 생성 요청: subjectId={}, topicId={}", request.subjectId(), request.topicId());
        return toResponse(workflow.generateOrFetch(request));
    }

    /**
     * 공용 코스 생성 - 모듈 생성 함수 응답 상태를 그대로 사용
     *
     * POST /generate_icp/predefined
     */
    @PostMapping("/generate_icp/predefined")
    public ResponseEntity<ApiResponse<CourseGenerationOutcome>> generatePredefined(
            @Valid @RequestBody CourseGenerationRequest request) {
        log.info("공용 코스 생성 요청: subjectId={}, topicId={}", request.subjectId(), request.topicId());
        return toResponse(workflow.generatePredefined(request));
    }

    private ResponseEntity<ApiResponse<CourseGenerationOutcome>> toResponse(CourseGenerationOutcome outcome) {
        return switch (outcome.status()) {
            case ALREADY_EXISTS -> ResponseEntity.ok(ApiResponse.success(outcome));
            case STORED -> ResponseEntity.status(HttpStatus.CREATED).body(ApiResponse.success(outcome));
            case UPSTREAM_ERROR -> fail(ErrorCode.GENERATION_UPSTREAM_ERROR, outcome);
            case MALFORMED_UPSTREAM -> fail(ErrorCode.GENERATION_MALFORMED_RESPONSE, outcome);
            case FORWARDED -> {
                HttpStatus status = HttpStatus.resolve(outcome.upstreamStatus());
                if (status == null) {
                    status = HttpStatus.BAD_GATEWAY;
                }
                yield status.is2xxSuccessful()
                        ? ResponseEntity.status(status).body(ApiResponse.success(outcome))
                        : ResponseEntity.status(status).body(ApiResponse.fail(
                                ErrorCode.GENERATION_UPSTREAM_ERROR.toErrorInfo(), outcome));
            }
        };
    }

    private static ResponseEntity<ApiResponse<CourseGenerationOutcome>> fail(ErrorCode errorCode,
                                                                             CourseGenerationOutcome outcome) {
        return ResponseEntity
                .status(errorCode.getStatus())
                .body(ApiResponse.fail(errorCode.toErrorInfo(outcome.detail()), outcome));
    }
}
