package com.lessonflow.orchestrator.question;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * 기존 문항과 재생성 문항의 필드 단위 비교
 *
 * 기존 문항은 대시보드가 보낸 원본 Map이라 CorrectAnswer가 숫자/문자열 어느 쪽으로도 올 수 있다.
 * CorrectAnswer가 없으면 1로 본다.
 */
final class QuestionChangeDetector {

    static final String NO_CHANGES = "No changes detected";

    private static final String QUESTION_KEY = "Question";
    private static final String CORRECT_ANSWER_KEY = "CorrectAnswer";
    private static final int DEFAULT_CORRECT_ANSWER = 1;

    private QuestionChangeDetector() {
    }

    static List<String> detect(Map<String, Object> current, QuizQuestion regenerated) {
        List<String> changes = new ArrayList<>();

        if (!Objects.equals(text(current, QUESTION_KEY), regenerated.question())) {
            changes.add("Question text updated");
        }
        for (int number = 1; number <= QuizQuestion.OPTION_COUNT; number++) {
            if (!Objects.equals(text(current, QuizQuestion.optionKey(number)), regenerated.option(number))) {
                changes.add("Option " + number + " updated");
            }
            if (!Objects.equals(text(current, QuizQuestion.descriptionKey(number)), regenerated.description(number))) {
                changes.add("Explanation " + number + " updated");
            }
        }

        String previousAnswer = correctAnswer(current);
        String nextAnswer = String.valueOf(regenerated.correctAnswer());
        if (!previousAnswer.equals(nextAnswer)) {
            changes.add("Correct answer changed from " + previousAnswer + " to " + nextAnswer);
        }

        if (changes.isEmpty()) {
            changes.add(NO_CHANGES);
        }
        return changes;
    }

    private static String text(Map<String, Object> question, String key) {
        Object value = question.get(key);
        return value == null ? null : value.toString();
    }

    private static String correctAnswer(Map<String, Object> question) {
        Object value = question.get(CORRECT_ANSWER_KEY);
        if (value == null || value.toString().isBlank()) {
            return String.valueOf(DEFAULT_CORRECT_ANSWER);
        }
        return value.toString().trim();
    }
}
