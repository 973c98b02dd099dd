package com.lessonflow.orchestrator.store.item;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.NoArgsConstructor;
import lombok.Setter;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbAttribute;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbBean;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbPartitionKey;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbSortKey;

/**
 * 코스 생성 결과 - (소유자 이메일 소문자, topic_id) 당 하나
 *
 * 레코드가 존재한다는 사실 자체가 "이미 생성됨" 신호다.
 */
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
@DynamoDbBean
public class CourseGenerationItem {

    private String email;
    private String topicId;
    private String subjectId;
    /** 생성된 코스 JSON 원문 */
    private String course;
    private String env;
    private String createdAt;

    @DynamoDbPartitionKey
    @DynamoDbAttribute("email")
    public String getEmail() {
        return email;
    }

    @DynamoDbSortKey
    @DynamoDbAttribute("topic_id")
    public String getTopicId() {
        return topicId;
    }

    @DynamoDbAttribute("subject_id")
    public String getSubjectId() {
        return subjectId;
    }

    @DynamoDbAttribute("course")
    public String getCourse() {
        return course;
    }

    @DynamoDbAttribute("env")
    public String getEnv() {
        return env;
    }

    @DynamoDbAttribute("created_at")
    public String getCreatedAt() {
        return createdAt;
    }
}
