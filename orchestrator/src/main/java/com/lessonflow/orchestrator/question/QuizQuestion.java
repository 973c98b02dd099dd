package com.lessonflow.orchestrator.question;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

/**
 * 4지선다 퀴즈 문항
 *
 * JSON 필드 이름은 문항 저장소/대시보드 형식을 따른다 (Question, options__001, CorrectAnswer ...).
 * correctAnswer는 1~4 중 정답 보기 번호.
 */
public record QuizQuestion(
        @NotBlank @JsonProperty("Question") String question,
        @NotBlank @JsonProperty("options__001") String option1,
        @NotBlank @JsonProperty("description__001") String description1,
        @NotBlank @JsonProperty("options__002") String option2,
        @NotBlank @JsonProperty("description__002") String description2,
        @NotBlank @JsonProperty("options__003") String option3,
        @NotBlank @JsonProperty("description__003") String description3,
        @NotBlank @JsonProperty("options__004") String option4,
        @NotBlank @JsonProperty("description__004") String description4,
        @NotNull @Min(1) @Max(4) @JsonProperty("CorrectAnswer") Integer correctAnswer
) {

    public static final int OPTION_COUNT = 4;

    /**
     * @param number 1~4
     */
    public String option(int number) {
        return switch (number) {
            case 1 -> option1;
            case 2 -> option2;
            case 3 -> option3;
            case 4 -> option4;
            default -> throw new IllegalArgumentException("option number must be 1..4: " + number);
        };
    }

    /**
     * @param number 1~4
     */
    public String description(int number) {
        return switch (number) {
            case 1 -> description1;
            case 2 -> description2;
            case 3 -> description3;
            case 4 -> description4;
            default -> throw new IllegalArgumentException("description number must be 1..4: " + number);
        };
    }

    static String optionKey(int number) {
        return "options__00" + number;
    }

    static String descriptionKey(int number) {
        return "description__00" + number;
    }
}
