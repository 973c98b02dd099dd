package com.lessonflow.orchestrator.question;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.lessonflow.common.exception.BusinessException;
import com.lessonflow.common.exception.ErrorCode;
import com.lessonflow.orchestrator.client.QuestionGeneratorClient;
import com.lessonflow.orchestrator.dto.QuestionGenerationRequest;
import com.lessonflow.orchestrator.dto.QuestionRegenerationRequest;
import jakarta.validation.Validation;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.BDDMockito.given;
import static org.mockito.BDDMockito.then;
import static org.mockito.Mockito.mock;

class QuestionAuthoringServiceTest {

    private static final String VALID_CONTENT = """
            {"questions": [{
              "Question": "What is 1/2 + 1/4?",
              "options__001": "3/4", "description__001": "Common denominator 4.",
              "options__002": "2/6", "description__002": "Adds tops and bottoms.",
              "options__003": "1/8", "description__003": "Multiplies instead.",
              "options__004": "1", "description__004": "Too large.",
              "CorrectAnswer": 1
            }]}
            """;

    private QuestionGeneratorClient generatorClient;
    private QuestionAuthoringService service;

    @BeforeEach
    void setUp() {
        generatorClient = mock(QuestionGeneratorClient.class);
        service = new QuestionAuthoringService(generatorClient, new ObjectMapper(),
                Validation.buildDefaultValidatorFactory().getValidator());
    }

    @Test
    @DisplayName("생성: 첫 번째 문항을 돌려주고 프롬프트에 과목/주제/난이도/학년이 들어간다")
    void generate_returnsFirstQuestion() {
        // given
        given(generatorClient.complete(anyString(), anyString())).willReturn(Optional.of(VALID_CONTENT));

        // when
        QuestionGenerationResult result = service.generate(generationRequest());

        // then
        assertThat(result.question().question()).isEqualTo("What is 1/2 + 1/4?");
        assertThat(result.question().correctAnswer()).isEqualTo(1);

        ArgumentCaptor<String> userPrompt = ArgumentCaptor.forClass(String.class);
        then(generatorClient).should().complete(eq(QuestionPrompts.SYSTEM), userPrompt.capture());
        assertThat(userPrompt.getValue())
                .contains("medium", "Math", "Fractions - Adding", "Grade 5", "visual learners");
    }

    @Test
    @DisplayName("생성: CorrectAnswer가 1~4 밖이면 GENERATION_MALFORMED_RESPONSE")
    void generate_rejectsOutOfRangeAnswer() {
        // given
        given(generatorClient.complete(anyString(), anyString()))
                .willReturn(Optional.of(VALID_CONTENT.replace("\"CorrectAnswer\": 1", "\"CorrectAnswer\": 5")));

        // when & then
        assertThatThrownBy(() -> service.generate(generationRequest()))
                .isInstanceOf(BusinessException.class)
                .hasMessageContaining("correctAnswer")
                .extracting(e -> ((BusinessException) e).getErrorCode())
                .isEqualTo(ErrorCode.GENERATION_MALFORMED_RESPONSE);
    }

    @Test
    @DisplayName("생성: content가 없거나 JSON이 아니거나 questions가 비면 GENERATION_MALFORMED_RESPONSE")
    void generate_rejectsMalformedContent() {
        // given
        given(generatorClient.complete(anyString(), anyString()))
                .willReturn(Optional.empty())
                .willReturn(Optional.of("Sure! Here is a question"))
                .willReturn(Optional.of("{\"questions\": []}"));

        // when & then
        for (int i = 0; i < 3; i++) {
            assertThatThrownBy(() -> service.generate(generationRequest()))
                    .isInstanceOf(BusinessException.class)
                    .extracting(e -> ((BusinessException) e).getErrorCode())
                    .isEqualTo(ErrorCode.GENERATION_MALFORMED_RESPONSE);
        }
    }

    @Test
    @DisplayName("재생성: 새 문항과 바뀐 필드 목록, 프롬프트에 수정 지시와 기존 문항 포함")
    void regenerate_reportsChanges() {
        // given
        given(generatorClient.complete(anyString(), anyString())).willReturn(Optional.of(VALID_CONTENT));
        Map<String, Object> current = Map.of(
                "Question", "What is 1/2 + 1/3?",
                "options__001", "3/4", "description__001", "Common denominator 4.",
                "options__002", "2/6", "description__002", "Adds tops and bottoms.",
                "options__003", "1/8", "description__003", "Multiplies instead.",
                "options__004", "1", "description__004", "Too large.",
                "CorrectAnswer", 1);
        QuestionRegenerationRequest request = new QuestionRegenerationRequest(
                current, "Use quarters", "Math", "Fractions", "Grade 5", "easy");

        // when
        QuestionRegenerationResult result = service.regenerate(request);

        // then
        assertThat(result.regeneratedQuestion().question()).isEqualTo("What is 1/2 + 1/4?");
        assertThat(result.changesSummary()).containsExactly("Question text updated");

        ArgumentCaptor<String> userPrompt = ArgumentCaptor.forClass(String.class);
        then(generatorClient).should().complete(eq(QuestionPrompts.SYSTEM), userPrompt.capture());
        assertThat(userPrompt.getValue()).contains("Use quarters", "What is 1/2 + 1/3?", "difficulty=easy");
    }

    private static QuestionGenerationRequest generationRequest() {
        return new QuestionGenerationRequest("Math", "Fractions", "Adding", "Grade 5", "medium", "visual", null);
    }
}
