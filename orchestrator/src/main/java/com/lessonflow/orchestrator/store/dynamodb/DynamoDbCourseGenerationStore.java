package com.lessonflow.orchestrator.store.dynamodb;

import com.lessonflow.orchestrator.config.LessonflowProperties;
import com.lessonflow.orchestrator.store.CourseGenerationStore;
import com.lessonflow.orchestrator.store.item.CourseGenerationItem;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Repository;
import software.amazon.awssdk.enhanced.dynamodb.DynamoDbEnhancedClient;
import software.amazon.awssdk.enhanced.dynamodb.DynamoDbTable;
import software.amazon.awssdk.enhanced.dynamodb.Expression;
import software.amazon.awssdk.enhanced.dynamodb.Key;
import software.amazon.awssdk.enhanced.dynamodb.TableSchema;
import software.amazon.awssdk.enhanced.dynamodb.model.PutItemEnhancedRequest;
import software.amazon.awssdk.services.dynamodb.model.ConditionalCheckFailedException;

import java.util.Map;

@Repository
@Slf4j
public class DynamoDbCourseGenerationStore implements CourseGenerationStore {

    private static final Expression NOT_EXISTS = Expression.builder()
            .expression("attribute_not_exists(#email)")
            .expressionNames(Map.of("#email", "email"))
            .build();

    private final DynamoDbTable<CourseGenerationItem> table;

    public DynamoDbCourseGenerationStore(DynamoDbEnhancedClient enhancedClient, LessonflowProperties properties) {
        this.table = enhancedClient.table(properties.getTables().getCourseGenerations(),
                TableSchema.fromBean(CourseGenerationItem.class));
    }

    @Override
    public boolean exists(String ownerEmail, String topicId) {
        CourseGenerationItem item = table.getItem(r -> r
                .key(Key.builder().partitionValue(ownerEmail).sortValue(topicId).build())
                .consistentRead(true));
        return item != null;
    }

    @Override
    public boolean saveIfAbsent(CourseGenerationItem item) {
        try {
            table.putItem(PutItemEnhancedRequest.builder(CourseGenerationItem.class)
                    .item(item)
                    .conditionExpression(NOT_EXISTS)
                    .build());
            return true;
        } catch (ConditionalCheckFailedException e) {
            log.info("코스 생성 결과가 이미 존재: email={}, topicId={}", item.getEmail(), item.getTopicId());
            return false;
        }
    }
}
