package com.lessonflow.orchestrator.store.dynamodb;

import com.lessonflow.orchestrator.config.LessonflowProperties;
import com.lessonflow.orchestrator.store.TestSeriesStore;
import com.lessonflow.orchestrator.store.item.GenerationJobRecord;
import com.lessonflow.orchestrator.store.item.TestSeriesItem;
import com.lessonflow.orchestrator.store.item.UserTestSeriesItem;
import org.springframework.stereotype.Repository;
import software.amazon.awssdk.enhanced.dynamodb.DynamoDbEnhancedClient;
import software.amazon.awssdk.enhanced.dynamodb.DynamoDbTable;
import software.amazon.awssdk.enhanced.dynamodb.Key;
import software.amazon.awssdk.enhanced.dynamodb.TableSchema;

import java.util.Optional;

@Repository
public class DynamoDbTestSeriesStore implements TestSeriesStore {

    private final DynamoDbTable<TestSeriesItem> predefinedTable;
    private final DynamoDbTable<UserTestSeriesItem> userTable;

    public DynamoDbTestSeriesStore(DynamoDbEnhancedClient enhancedClient, LessonflowProperties properties) {
        this.predefinedTable = enhancedClient.table(properties.getTables().getPredefinedTestSeries(),
                TableSchema.fromBean(TestSeriesItem.class));
        this.userTable = enhancedClient.table(properties.getTables().getUserTestSeries(),
                TableSchema.fromBean(UserTestSeriesItem.class));
    }

    @Override
    public Optional<GenerationJobRecord> findPredefined(String jobId) {
        // 폴링 중 생성기가 방금 쓴 값을 봐야 하므로 강한 일관성 읽기
        TestSeriesItem item = predefinedTable.getItem(r -> r
                .key(Key.builder().partitionValue(jobId).build())
                .consistentRead(true));
        return Optional.ofNullable(item);
    }

    @Override
    public Optional<GenerationJobRecord> findUserScoped(String userEmail, String jobId) {
        UserTestSeriesItem item = userTable.getItem(r -> r
                .key(Key.builder().partitionValue(userEmail).sortValue(jobId).build())
                .consistentRead(true));
        return Optional.ofNullable(item);
    }
}
