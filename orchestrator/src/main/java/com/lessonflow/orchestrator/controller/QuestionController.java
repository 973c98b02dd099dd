package com.lessonflow.orchestrator.controller;

import com.lessonflow.common.dto.ApiResponse;
import com.lessonflow.orchestrator.dto.QuestionGenerationRequest;
import com.lessonflow.orchestrator.dto.QuestionRegenerationRequest;
import com.lessonflow.orchestrator.question.QuestionAuthoringService;
import com.lessonflow.orchestrator.question.QuestionGenerationResult;
import com.lessonflow.orchestrator.question.QuestionRegenerationResult;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * 퀴즈 문항 생성 API
 *
 * 400: 요청 검증 실패 (difficulty는 easy|medium|hard)
 * 502: LLM 호출 실패 또는 응답 형식 오류
 */
@RestController
@RequestMapping("/api/ai")
@RequiredArgsConstructor
public class QuestionController {

    private final QuestionAuthoringService questionService;

    @PostMapping("/generate-question")
    public ResponseEntity<ApiResponse<QuestionGenerationResult>> generate(
            @Valid @RequestBody QuestionGenerationRequest request) {
        return ResponseEntity.ok(ApiResponse.success(questionService.generate(request)));
    }

    @PostMapping("/regenerate-question")
    public ResponseEntity<ApiResponse<QuestionRegenerationResult>> regenerate(
            @Valid @RequestBody QuestionRegenerationRequest request) {
        return ResponseEntity.ok(ApiResponse.success(questionService.regenerate(request)));
    }
}
