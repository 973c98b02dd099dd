package com.lessonflow.orchestrator.controller;

import com.lessonflow.common.dto.ApiResponse;
import com.lessonflow.common.exception.ErrorCode;
import com.lessonflow.orchestrator.config.LessonflowProperties;
import com.lessonflow.orchestrator.dto.TestSeriesGenerationRequest;
import com.lessonflow.orchestrator.generation.CancellationSignal;
import com.lessonflow.orchestrator.generation.DispatchOutcome;
import com.lessonflow.orchestrator.generation.TestSeriesGenerationWorkflow;
import com.lessonflow.orchestrator.generation.TestSeriesStatusView;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;

@RestController
@RequiredArgsConstructor
@Slf4j
public class TestSeriesController {

    private final TestSeriesGenerationWorkflow workflow;
    private final LessonflowProperties properties;
    private final Clock clock;

    /**
     * 테스트 시리즈 생성 요청 후 완료까지 대기
     *
     * POST /generate_itp
     *
     * 응답 상태:
     * - 200: 생성 완료(DONE) 또는 생성기의 예상 밖 200 응답(UNEXPECTED)
     * - 202: 대기 시간 초과, 생성은 계속 진행 중 (GET /generate_itp/{id}/status로 확인)
     * - 400: 이미 생성된 시리즈
     * - 502: 생성기/저장소 오류
     */
    @PostMapping("/generate_itp")
    public ResponseEntity<ApiResponse<DispatchOutcome>> generate(@RequestBody TestSeriesGenerationRequest request) {
        log.info("테스트 시리즈 생성 요청: user_id={}, predefined={}", request.getUserId(), request.isPredefined());

        CancellationSignal deadline = CancellationSignal.deadline(clock,
                clock.instant().plus(properties.getPolling().getRequestTimeout()));
        DispatchOutcome outcome = workflow.dispatchAndPoll(request, deadline);

        return switch (outcome.status()) {
            case DONE, UNEXPECTED -> ResponseEntity.ok(ApiResponse.success(outcome));
            case TIMEOUT -> ResponseEntity.status(HttpStatus.ACCEPTED).body(ApiResponse.success(outcome));
            case ALREADY_DONE -> fail(ErrorCode.TEST_SERIES_ALREADY_GENERATED, null, outcome);
            case ERROR -> fail(ErrorCode.GENERATION_UPSTREAM_ERROR, outcome.detail(), outcome);
        };
    }

    /**
     * 현재 상태 한 번 조회 (폴링 없음)
     *
     * GET /generate_itp/{id}/status?user_id=...&predefined=false
     */
    @GetMapping("/generate_itp/{id}/status")
    public ResponseEntity<ApiResponse<TestSeriesStatusView>> status(
            @PathVariable("id") String id,
            @RequestParam(name = "user_id", required = false) String userId,
            @RequestParam(name = "predefined", defaultValue = "true") boolean predefined) {
        TestSeriesStatusView view = workflow.checkStatus(id, userId, predefined);

        return switch (view.state()) {
            case GENERATED, GENERATING -> ResponseEntity.ok(ApiResponse.success(view));
            case NOT_FOUND -> fail(ErrorCode.TEST_SERIES_NOT_FOUND, id, view);
            case ERROR -> fail(ErrorCode.TEST_SERIES_STATE_UNKNOWN, view.detail(), view);
        };
    }

    private static <T> ResponseEntity<ApiResponse<T>> fail(ErrorCode errorCode, String detail, T data) {
        return ResponseEntity
                .status(errorCode.getStatus())
                .body(ApiResponse.fail(detail == null ? errorCode.toErrorInfo() : errorCode.toErrorInfo(detail), data));
    }
}
