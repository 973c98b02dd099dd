package com.lessonflow.orchestrator.controller;

import com.lessonflow.common.dto.ApiResponse;
import com.lessonflow.orchestrator.dto.StudentSubjectLinkRequest;
import com.lessonflow.orchestrator.linker.BulkLinkReport;
import com.lessonflow.orchestrator.linker.StudentSubjectLinkService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequiredArgsConstructor
public class StudentSubjectController {

    private final StudentSubjectLinkService linkService;

    /**
     * 학생들의 subject_list에 레슨 UUID 추가
     *
     * POST /update_student_subjects
     */
    @PostMapping("/update_student_subjects")
    public ResponseEntity<ApiResponse<BulkLinkReport>> updateStudentSubjects(
            @Valid @RequestBody StudentSubjectLinkRequest request) {
        BulkLinkReport report = linkService.linkStudents(
                request.body().lessonPlannerUuid(), request.body().students());
        return ResponseEntity.ok(ApiResponse.success(report));
    }
}
