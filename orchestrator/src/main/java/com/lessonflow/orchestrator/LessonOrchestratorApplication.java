package com.lessonflow.orchestrator;

import com.lessonflow.orchestrator.config.LessonflowProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication(scanBasePackages = {
        "com.lessonflow.orchestrator",
        "com.lessonflow.common"  // GlobalExceptionHandler, IdempotencyAspect, IdempotencyService 스캔
})
@EnableConfigurationProperties(LessonflowProperties.class)
public class LessonOrchestratorApplication {
    public static void main(String[] args) {
        SpringApplication.run(LessonOrchestratorApplication.class, args);
    }
}
