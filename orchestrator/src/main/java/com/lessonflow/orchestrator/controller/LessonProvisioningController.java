package com.lessonflow.orchestrator.controller;

import com.lessonflow.common.dto.ApiResponse;
import com.lessonflow.common.exception.ErrorCode;
import com.lessonflow.common.idempotency.Idempotent;
import com.lessonflow.orchestrator.dto.LessonProvisionRequest;
import com.lessonflow.orchestrator.saga.LessonProvisioningSaga;
import com.lessonflow.orchestrator.saga.ProvisionReport;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequiredArgsConstructor
@Slf4j
public class LessonProvisioningController {

    private final LessonProvisioningSaga saga;

    /**
     * 레슨 프로비저닝
     *
     * POST /process_all
     * Headers: X-Idempotency-Key: {unique-key} (선택)
     * {
     *   "subject": "Algebra",
     *   "body": {
     *     "lesson_planner_UUID": "...",
     *     "grade": "9", "section": "A", "period": "3",
     *     "teacher_id": "42",
     *     "student": ["a@school.org", "b@school.org"]
     *   }
     * }
     *
     * 레슨 레코드 생성 실패 → 502, 그 외에는 일부 단계가 실패해도 200 + 리포트
     */
    @PostMapping("/process_all")
    @Idempotent(prefix = "process-all")
    public ResponseEntity<ApiResponse<ProvisionReport>> processAll(
            @Valid @RequestBody LessonProvisionRequest request) {
        log.info("프로비저닝 요청 수신: lesson={}, subject={}",
                request.body().getLessonPlannerUuid(), request.subject());

        ProvisionReport report = saga.provision(request);

        if (report.fatal()) {
            ErrorCode errorCode = ErrorCode.LESSON_RECORD_CREATE_FAILED;
            return ResponseEntity
                    .status(errorCode.getStatus())
                    .body(ApiResponse.fail(errorCode.toErrorInfo(report.stepErrors().get(0).message()), report));
        }
        return ResponseEntity.ok(ApiResponse.success(report));
    }
}
