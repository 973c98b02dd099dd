package com.lessonflow.orchestrator.generation;

import com.lessonflow.common.exception.BusinessException;
import com.lessonflow.common.exception.ErrorCode;
import com.lessonflow.common.logging.RequestIdFilter;
import com.lessonflow.orchestrator.client.GeneratorEnvelope;
import com.lessonflow.orchestrator.client.TestSeriesGeneratorClient;
import com.lessonflow.orchestrator.config.LessonflowProperties;
import com.lessonflow.orchestrator.dto.TestSeriesGenerationRequest;
import com.lessonflow.orchestrator.store.TestSeriesStore;
import com.lessonflow.orchestrator.store.item.GenerationJobRecord;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Optional;

/**
 * 테스트 시리즈 생성 요청 후 완료까지 폴링
 *
 * <pre>
 * DISPATCH ─ 400 ─────────────────────────→ ALREADY_DONE
 *          ├ 200 + generating + id ─→ POLL ─ Generated=true ──→ DONE
 *          │                              ├ Generated=false ─→ POLL (다음 시도)
 *          │                              ├ 플래그/레코드 없음 ─→ ERROR
 *          │                              └ 시도 소진/취소 ────→ TIMEOUT
 *          ├ 200 (그 외) ──────────────────→ UNEXPECTED
 *          └ 그 외 상태/전송 실패 ─────────→ ERROR
 * </pre>
 *
 * 폴링은 대기 후 조회 순서이며 요청 스레드에서 실행된다.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class TestSeriesGenerationWorkflow {

    private final TestSeriesGeneratorClient generatorClient;
    private final TestSeriesStore testSeriesStore;
    private final PollSleeper pollSleeper;
    private final LessonflowProperties properties;

    public DispatchOutcome dispatchAndPoll(TestSeriesGenerationRequest request, CancellationSignal cancellation) {
        requireUserForUserScoped(request.getUserId(), request.isPredefined());

        GeneratorEnvelope envelope;
        try {
            envelope = generatorClient.initialize(request.toGeneratorPayload());
        } catch (Exception e) {
            log.error("[ITP] 생성 요청 실패: {}", e.getMessage());
            return DispatchOutcome.error(null, e.getMessage());
        }

        if (envelope.statusCode() == 400) {
            log.info("[ITP] 이미 생성된 시리즈");
            return DispatchOutcome.alreadyDone(envelope.body());
        }
        if (envelope.isGenerating()) {
            return poll(envelope.jobId(), request.getUserId(), request.isPredefined(), cancellation);
        }
        if (envelope.statusCode() == 200) {
            log.warn("[ITP] 예상하지 못한 200 응답: {}", envelope.body());
            return DispatchOutcome.unexpected(envelope.body());
        }

        log.error("[ITP] 생성기 오류 응답: statusCode={}", envelope.statusCode());
        return DispatchOutcome.error(null, "generator returned status " + envelope.statusCode());
    }

    /**
     * 폴링 없이 현재 상태 한 번 조회
     */
    public TestSeriesStatusView checkStatus(String jobId, String userEmail, boolean predefined) {
        requireUserForUserScoped(userEmail, predefined);

        Optional<GenerationJobRecord> record;
        try {
            record = read(jobId, userEmail, predefined);
        } catch (Exception e) {
            log.error("[ITP] 상태 조회 실패: jobId={}, 원인={}", jobId, e.getMessage());
            return new TestSeriesStatusView(jobId, JobState.ERROR, null, e.getMessage());
        }

        JobState state = classify(record);
        String title = record.map(GenerationJobRecord::getSeriesTitle).orElse(null);
        return new TestSeriesStatusView(jobId, state, title, null);
    }

    private DispatchOutcome poll(String jobId, String userEmail, boolean predefined,
                                 CancellationSignal cancellation) {
        LessonflowProperties.Polling polling = properties.getPolling();
        Duration interval = polling.getInterval();
        int maxAttempts = polling.getMaxAttempts();

        MDC.put(RequestIdFilter.MDC_WORKFLOW_ID, jobId);
        try {
            log.info("[ITP] 폴링 시작: jobId={}, predefined={}, maxAttempts={}", jobId, predefined, maxAttempts);

            for (int attempt = 1; attempt <= maxAttempts; attempt++) {
                if (cancellation.isCancelled()) {
                    log.warn("[ITP] 폴링 취소 (시도 {}회 전)", attempt);
                    return DispatchOutcome.timeout(jobId);
                }

                try {
                    pollSleeper.sleep(interval);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    log.warn("[ITP] 폴링 중 인터럽트");
                    return DispatchOutcome.timeout(jobId);
                }

                if (cancellation.isCancelled()) {
                    log.warn("[ITP] 폴링 취소 (대기 중 마감)");
                    return DispatchOutcome.timeout(jobId);
                }

                Optional<GenerationJobRecord> record;
                try {
                    record = read(jobId, userEmail, predefined);
                } catch (Exception e) {
                    log.error("[ITP] 상태 조회 실패: {}", e.getMessage());
                    return DispatchOutcome.error(jobId, e.getMessage());
                }

                JobState state = classify(record);
                log.info("[POLL] 시도 {}/{}: state={}", attempt, maxAttempts, state);

                switch (state) {
                    case GENERATED:
                        return DispatchOutcome.done(jobId, record.get().getSeriesTitle());
                    case GENERATING:
                        continue;
                    case NOT_FOUND:
                        return DispatchOutcome.error(jobId, "generation job not found");
                    default:
                        return DispatchOutcome.error(jobId, "generation job has no Generated flag");
                }
            }

            log.warn("[ITP] 폴링 시간 초과: jobId={}", jobId);
            return DispatchOutcome.timeout(jobId);
        } finally {
            MDC.remove(RequestIdFilter.MDC_WORKFLOW_ID);
        }
    }

    private Optional<GenerationJobRecord> read(String jobId, String userEmail, boolean predefined) {
        return predefined
                ? testSeriesStore.findPredefined(jobId)
                : testSeriesStore.findUserScoped(userEmail, jobId);
    }

    private static JobState classify(Optional<GenerationJobRecord> record) {
        if (record.isEmpty()) {
            return JobState.NOT_FOUND;
        }
        Boolean generated = record.get().getGenerated();
        if (generated == null) {
            return JobState.ERROR;
        }
        return generated ? JobState.GENERATED : JobState.GENERATING;
    }

    private static void requireUserForUserScoped(String userEmail, boolean predefined) {
        if (!predefined && (userEmail == null || userEmail.isBlank())) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "user_id is required when predefined=false");
        }
    }
}
