package com.lessonflow.orchestrator.store.item;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.NoArgsConstructor;
import lombok.Setter;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbAttribute;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbBean;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbPartitionKey;

/**
 * 레슨(과목) 레코드 - Grade_and_Subject 테이블
 *
 * 프로비저닝 시 한 번 생성되고 이후 이 서비스에서 수정하지 않는다.
 * 속성 이름은 기존 테이블 스키마를 그대로 따른다.
 */
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
@DynamoDbBean
public class LessonRecordItem {

    public static final String STATUS_ACTIVE = "Active";

    /** 호출자가 발급한 lesson_planner_UUID */
    private String id;
    private String createdAt;
    private String grade;
    private String gradeAndSubject;
    private String gradeAndSubjectUi;
    private String status;
    private String subject;
    private String tenantEmail;
    private String tenantName;
    private Integer quizCredit;
    private Integer courseCredit;
    private String icon;
    private String period;
    private String section;

    @DynamoDbPartitionKey
    @DynamoDbAttribute("id")
    public String getId() {
        return id;
    }

    @DynamoDbAttribute("Created_at")
    public String getCreatedAt() {
        return createdAt;
    }

    @DynamoDbAttribute("Grade")
    public String getGrade() {
        return grade;
    }

    @DynamoDbAttribute("Grade_and_Subject")
    public String getGradeAndSubject() {
        return gradeAndSubject;
    }

    @DynamoDbAttribute("Grade_and_Subject_UI")
    public String getGradeAndSubjectUi() {
        return gradeAndSubjectUi;
    }

    @DynamoDbAttribute("status")
    public String getStatus() {
        return status;
    }

    @DynamoDbAttribute("Subject")
    public String getSubject() {
        return subject;
    }

    @DynamoDbAttribute("tenantEmail")
    public String getTenantEmail() {
        return tenantEmail;
    }

    @DynamoDbAttribute("tenantName")
    public String getTenantName() {
        return tenantName;
    }

    @DynamoDbAttribute("quiz_credit")
    public Integer getQuizCredit() {
        return quizCredit;
    }

    @DynamoDbAttribute("course_credit")
    public Integer getCourseCredit() {
        return courseCredit;
    }

    @DynamoDbAttribute("icon")
    public String getIcon() {
        return icon;
    }

    @DynamoDbAttribute("Period")
    public String getPeriod() {
        return period;
    }

    @DynamoDbAttribute("Section")
    public String getSection() {
        return section;
    }
}
