package com.lessonflow.orchestrator.controller;

import com.lessonflow.common.exception.BusinessException;
import com.lessonflow.common.exception.ErrorCode;
import com.lessonflow.common.exception.GlobalExceptionHandler;
import com.lessonflow.orchestrator.question.QuestionAuthoringService;
import com.lessonflow.orchestrator.question.QuestionGenerationResult;
import com.lessonflow.orchestrator.question.QuestionRegenerationResult;
import com.lessonflow.orchestrator.question.QuizQuestion;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.ResultActions;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.util.List;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.BDDMockito.given;
import static org.mockito.BDDMockito.then;
import static org.mockito.Mockito.mock;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

class QuestionControllerTest {

    private static final String GENERATE_BODY = """
            {"subject": "Math", "topic": "Fractions", "grade_level": "Grade 5", "difficulty": "medium"}
            """;

    private static final QuizQuestion QUESTION = new QuizQuestion("What is 1/2 + 1/4?",
            "3/4", "Common denominator 4.", "2/6", "Adds tops and bottoms.",
            "1/8", "Multiplies instead.", "1", "Too large.", 1);

    private QuestionAuthoringService questionService;
    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        questionService = mock(QuestionAuthoringService.class);
        mockMvc = MockMvcBuilders.standaloneSetup(new QuestionController(questionService))
                .setControllerAdvice(new GlobalExceptionHandler())
                .build();
    }

    @Test
    @DisplayName("생성 성공 → 200, 문항 필드 이름은 저장소 형식")
    void generate_returnsQuestion() throws Exception {
        given(questionService.generate(any())).willReturn(new QuestionGenerationResult(QUESTION));

        postJson("/api/ai/generate-question", GENERATE_BODY)
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.data.question.Question").value("What is 1/2 + 1/4?"))
                .andExpect(jsonPath("$.data.question.options__001").value("3/4"))
                .andExpect(jsonPath("$.data.question.CorrectAnswer").value(1));
    }

    @Test
    @DisplayName("difficulty가 easy|medium|hard가 아니면 400, 생성 호출 없음")
    void generate_rejectsUnknownDifficulty() throws Exception {
        postJson("/api/ai/generate-question", GENERATE_BODY.replace("medium", "extreme"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.errorInfo.code").value("COMMON_001"))
                .andExpect(jsonPath("$.errorInfo.detail").value("difficulty"));

        then(questionService).shouldHaveNoInteractions();
    }

    @Test
    @DisplayName("LLM 응답 형식 오류 → 502")
    void generate_malformedUpstream() throws Exception {
        given(questionService.generate(any()))
                .willThrow(new BusinessException(ErrorCode.GENERATION_MALFORMED_RESPONSE, "invalid fields: correctAnswer"));

        postJson("/api/ai/generate-question", GENERATE_BODY)
                .andExpect(status().isBadGateway())
                .andExpect(jsonPath("$.errorInfo.code").value("GENERATION_003"));
    }

    @Test
    @DisplayName("재생성 성공 → 200, regenerated_question과 changes_summary")
    void regenerate_returnsChanges() throws Exception {
        given(questionService.regenerate(any()))
                .willReturn(new QuestionRegenerationResult(QUESTION, List.of("Question text updated")));

        postJson("/api/ai/regenerate-question", """
                {"current_question": {"Question": "What is 1/2 + 1/3?"},
                 "edit_instruction": "Use quarters",
                 "subject": "Math", "topic": "Fractions", "grade_level": "Grade 5", "difficulty": "easy"}
                """)
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.regenerated_question.Question").value("What is 1/2 + 1/4?"))
                .andExpect(jsonPath("$.data.changes_summary[0]").value("Question text updated"));
    }

    @Test
    @DisplayName("재생성: current_question이 없으면 400")
    void regenerate_requiresCurrentQuestion() throws Exception {
        postJson("/api/ai/regenerate-question", """
                {"edit_instruction": "Use quarters",
                 "subject": "Math", "topic": "Fractions", "grade_level": "Grade 5", "difficulty": "easy"}
                """)
                .andExpect(status().isBadRequest());

        then(questionService).shouldHaveNoInteractions();
    }

    private ResultActions postJson(String path, String body) throws Exception {
        return mockMvc.perform(post(path).contentType(MediaType.APPLICATION_JSON).content(body));
    }
}
