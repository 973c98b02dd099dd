package com.lessonflow.orchestrator.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * 오케스트레이터 설정 프로퍼티
 *
 * application.yml의 lessonflow.* 설정을 바인딩하고 필수 값을 검증한다.
 * URL/키가 비어 있으면 애플리케이션 시작 시 실패한다.
 */
@Getter
@Setter
@Validated
@ConfigurationProperties(prefix = "lessonflow")
public class LessonflowProperties {

    /**
     * 생성 결과에 남기는 환경 태그 (production | staging ...)
     */
    @NotBlank
    private String environment = "production";

    @Valid
    private Tenant tenant = new Tenant();

    @Valid
    private Gateway gateway = new Gateway();

    @Valid
    private Generator generator = new Generator();

    @Valid
    private QuestionGenerator questionGenerator = new QuestionGenerator();

    @Valid
    private Polling polling = new Polling();

    @Valid
    private Tables tables = new Tables();

    @Valid
    private ModuleFunction moduleFunction = new ModuleFunction();

    @Valid
    private Cors cors = new Cors();

    @Getter
    @Setter
    public static class Tenant {
        /** 요청에 tenantEmail이 없을 때 사용 */
        @NotBlank
        private String defaultEmail;
        @NotBlank
        private String defaultName;
        /** 레슨 레코드 표시 아이콘 */
        @NotBlank
        private String icon;
    }

    @Getter
    @Setter
    public static class Gateway {
        /** x-api-key 헤더 값 (환경 변수: LESSON_PLANNER_API_KEY) */
        @NotBlank
        private String apiKey;
        @NotBlank
        private String schoolLookupUrl;
        @NotBlank
        private String subjectInsertUrl;
        /** query_name 파라미터로 분기되는 쿼리 엔드포인트 */
        @NotBlank
        private String queryUrl;
        /** insert 전용 엔드포인트 (insert_lesson_planner_payload) */
        @NotBlank
        private String insertUrl;
        /** 학생 조회 시 사용하는 고정 school_id */
        private int studentSchoolId = 3;
    }

    @Getter
    @Setter
    public static class Generator {
        /** 테스트 시리즈(ITP) 초기화 엔드포인트 */
        @NotBlank
        private String testSeriesInitializeUrl;
        /** 코스(ICP) 생성 엔드포인트 */
        @NotBlank
        private String courseGenerateUrl;
        /** 코스 생성은 LLM 호출이라 오래 걸린다 */
        @NotNull
        private Duration readTimeout = Duration.ofSeconds(180);
    }

    /**
     * 퀴즈 문항 생성용 LLM (OpenAI 호환 chat completions)
     */
    @Getter
    @Setter
    public static class QuestionGenerator {
        @NotBlank
        private String url = "https://api.openai.com/v1/chat/completions";
        /** 환경 변수: OPENAI_API_KEY */
        @NotBlank
        private String apiKey;
        @NotBlank
        private String model = "gpt-4o-2024-08-06";
    }

    @Getter
    @Setter
    public static class Polling {
        @NotNull
        private Duration interval = Duration.ofSeconds(3);
        @Min(1)
        private int maxAttempts = 80;
        /** 요청 전체 마감 시간 (초과 시 폴링 중단, TIMEOUT 응답) */
        @NotNull
        private Duration requestTimeout = Duration.ofSeconds(250);
    }

    @Getter
    @Setter
    public static class Tables {
        @NotBlank
        private String lessonRecords = "Grade_and_Subject";
        @NotBlank
        private String students = "Investor";
        @NotBlank
        private String predefinedTestSeries = "Question";
        @NotBlank
        private String userTestSeries = "User_Infinite_TestSeries";
        @NotBlank
        private String courseGenerations = "Course_Generation";
    }

    @Getter
    @Setter
    public static class ModuleFunction {
        @NotBlank
        private String functionName = "createPredefinedModule";
        @NotBlank
        private String alias = "Production";
    }

    /**
     * 대시보드 프론트엔드 호출용 CORS
     */
    @Getter
    @Setter
    public static class Cors {
        /** 기본값은 모든 출처 허용 (credentials와 함께 쓰려면 패턴으로 지정) */
        @NotEmpty
        private List<String> allowedOriginPatterns = new ArrayList<>(List.of("*"));
        private boolean allowCredentials = true;
        @NotNull
        private Duration maxAge = Duration.ofDays(1);
    }
}
