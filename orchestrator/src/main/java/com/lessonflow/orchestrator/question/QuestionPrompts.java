package com.lessonflow.orchestrator.question;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.lessonflow.orchestrator.dto.QuestionGenerationRequest;
import com.lessonflow.orchestrator.dto.QuestionRegenerationRequest;

/**
 * 문항 생성 프롬프트
 */
final class QuestionPrompts {

    static final String SYSTEM = """
            You are an expert educator creating high-quality quiz questions.

            Requirements:
            1. Educationally valuable, not rote
            2. Clear, age-appropriate language
            3. Use LaTeX for math/science
            4. Explanations: 2-3 sentences
            5. Exactly one correct option

            Respond with a JSON object of the form
            {"questions": [{"Question": "...",
              "options__001": "...", "description__001": "...",
              "options__002": "...", "description__002": "...",
              "options__003": "...", "description__003": "...",
              "options__004": "...", "description__004": "...",
              "CorrectAnswer": 1}]}
            where CorrectAnswer is the number (1-4) of the correct option.
            """;

    private QuestionPrompts() {
    }

    static String generate(QuestionGenerationRequest request) {
        StringBuilder prompt = new StringBuilder()
                .append("Create a ").append(request.difficulty())
                .append(" quiz question for ").append(request.subject())
                .append(" on ").append(request.topic());
        if (hasText(request.subtopic())) {
            prompt.append(" - ").append(request.subtopic());
        }
        prompt.append(" for ").append(request.gradeLevel()).append(" students.\n\n")
                .append("- 4 MCQ options\n")
                .append("- Detailed explanations\n")
                .append("- Only one correct answer\n");
        if (hasText(request.learningStyle())) {
            prompt.append("- Adapt for ").append(request.learningStyle()).append(" learners\n");
        }
        if (hasText(request.additionalContext())) {
            prompt.append("Additional context: ").append(request.additionalContext()).append('\n');
        }
        return prompt.toString();
    }

    static String regenerate(QuestionRegenerationRequest request, ObjectMapper objectMapper) {
        String current;
        try {
            current = objectMapper.writeValueAsString(request.currentQuestion());
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("current_question is not serializable", e);
        }
        return "Modify this quiz question with instruction: " + request.editInstruction() + "\n"
                + "Current question: " + current + "\n"
                + "Keep subject=" + request.subject() + ", topic=" + request.topic()
                + ", grade=" + request.gradeLevel() + ", difficulty=" + request.difficulty() + ".\n"
                + "Ensure all options and explanations are coherent and only one is correct.\n";
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }
}
