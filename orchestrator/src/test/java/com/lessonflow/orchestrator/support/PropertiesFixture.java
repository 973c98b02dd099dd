package com.lessonflow.orchestrator.support;

import com.lessonflow.orchestrator.config.LessonflowProperties;

import java.time.Duration;

/**
 * 단위 테스트용 LessonflowProperties (application.yml 없이 구성)
 */
public final class PropertiesFixture {

    public static final String DEFAULT_TENANT_EMAIL = "tenant@school.org";
    public static final String DEFAULT_TENANT_NAME = "Test School";

    private PropertiesFixture() {
    }

    public static LessonflowProperties create() {
        LessonflowProperties properties = new LessonflowProperties();
        properties.setEnvironment("test");

        properties.getTenant().setDefaultEmail(DEFAULT_TENANT_EMAIL);
        properties.getTenant().setDefaultName(DEFAULT_TENANT_NAME);
        properties.getTenant().setIcon("https://cdn.test/icon.png");

        LessonflowProperties.Gateway gateway = properties.getGateway();
        gateway.setApiKey("test-key");
        gateway.setSchoolLookupUrl("http://gateway.test/school");
        gateway.setSubjectInsertUrl("http://gateway.test/subject");
        gateway.setQueryUrl("http://gateway.test/query");
        gateway.setInsertUrl("http://gateway.test/insert");

        properties.getGenerator().setTestSeriesInitializeUrl("http://generator.test/itp/initialize");
        properties.getGenerator().setCourseGenerateUrl("http://generator.test/icp/generate");

        properties.getQuestionGenerator().setUrl("http://llm.test/v1/chat/completions");
        properties.getQuestionGenerator().setApiKey("llm-key");

        properties.getPolling().setInterval(Duration.ofSeconds(3));
        properties.getPolling().setMaxAttempts(80);
        return properties;
    }
}
