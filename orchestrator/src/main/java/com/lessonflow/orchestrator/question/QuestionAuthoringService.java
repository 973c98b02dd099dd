package com.lessonflow.orchestrator.question;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.lessonflow.common.exception.BusinessException;
import com.lessonflow.common.exception.ErrorCode;
import com.lessonflow.orchestrator.client.QuestionGeneratorClient;
import com.lessonflow.orchestrator.dto.QuestionGenerationRequest;
import com.lessonflow.orchestrator.dto.QuestionRegenerationRequest;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * 퀴즈 문항 생성/재생성
 *
 * <pre>
 * 1. 프롬프트 구성 → LLM 호출 (실패 → GENERATION_UPSTREAM_ERROR)
 * 2. content의 questions[0]을 QuizQuestion으로 변환
 * 3. 필드 검증 (빈 보기, CorrectAnswer 1~4 범위 밖 → GENERATION_MALFORMED_RESPONSE)
 * 4. 재생성이면 기존 문항과 필드 단위 비교
 * </pre>
 *
 * 생성 결과는 저장하지 않는다. 저장은 대시보드가 확인 후 직접 한다.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class QuestionAuthoringService {

    private final QuestionGeneratorClient generatorClient;
    private final ObjectMapper objectMapper;
    private final Validator validator;

    public QuestionGenerationResult generate(QuestionGenerationRequest request) {
        log.info("[Question] 생성: subject={}, topic={}, difficulty={}",
                request.subject(), request.topic(), request.difficulty());

        QuizQuestion question = requestQuestion(QuestionPrompts.generate(request));
        return new QuestionGenerationResult(question);
    }

    public QuestionRegenerationResult regenerate(QuestionRegenerationRequest request) {
        log.info("[Question] 재생성: subject={}, topic={}, instruction={}",
                request.subject(), request.topic(), request.editInstruction());

        QuizQuestion question = requestQuestion(QuestionPrompts.regenerate(request, objectMapper));
        List<String> changes = QuestionChangeDetector.detect(request.currentQuestion(), question);

        log.info("[Question] 재생성 완료: changes={}", changes);
        return new QuestionRegenerationResult(question, changes);
    }

    private QuizQuestion requestQuestion(String userPrompt) {
        String content = generatorClient.complete(QuestionPrompts.SYSTEM, userPrompt)
                .orElseThrow(() -> malformed("message content missing"));

        JsonNode first;
        try {
            first = objectMapper.readTree(content).path("questions").path(0);
        } catch (JsonProcessingException e) {
            throw malformed("content is not JSON");
        }
        if (!first.isObject()) {
            throw malformed("questions[0] missing");
        }

        QuizQuestion question;
        try {
            question = objectMapper.treeToValue(first, QuizQuestion.class);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw malformed("questions[0] has unexpected shape: " + e.getMessage());
        }

        Set<ConstraintViolation<QuizQuestion>> violations = validator.validate(question);
        if (!violations.isEmpty()) {
            String fields = violations.stream()
                    .map(v -> v.getPropertyPath().toString())
                    .sorted()
                    .distinct()
                    .collect(Collectors.joining(","));
            throw malformed("invalid fields: " + fields);
        }
        return question;
    }

    private static BusinessException malformed(String detail) {
        log.warn("[Question] 생성 응답 형식 오류: {}", detail);
        return new BusinessException(ErrorCode.GENERATION_MALFORMED_RESPONSE, detail);
    }
}
