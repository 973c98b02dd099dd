package com.lessonflow.orchestrator.store.dynamodb;

import com.lessonflow.orchestrator.config.LessonflowProperties;
import com.lessonflow.orchestrator.store.LessonRecordStore;
import com.lessonflow.orchestrator.store.item.LessonRecordItem;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Repository;
import software.amazon.awssdk.enhanced.dynamodb.DynamoDbEnhancedClient;
import software.amazon.awssdk.enhanced.dynamodb.DynamoDbTable;
import software.amazon.awssdk.enhanced.dynamodb.Key;
import software.amazon.awssdk.enhanced.dynamodb.TableSchema;

import java.util.Optional;

@Repository
@Slf4j
public class DynamoDbLessonRecordStore implements LessonRecordStore {

    private final DynamoDbTable<LessonRecordItem> table;

    public DynamoDbLessonRecordStore(DynamoDbEnhancedClient enhancedClient, LessonflowProperties properties) {
        this.table = enhancedClient.table(properties.getTables().getLessonRecords(),
                TableSchema.fromBean(LessonRecordItem.class));
    }

    @Override
    public void save(LessonRecordItem record) {
        table.putItem(record);
        log.debug("레슨 레코드 저장: id={}", record.getId());
    }

    @Override
    public Optional<LessonRecordItem> findById(String id) {
        return Optional.ofNullable(table.getItem(Key.builder().partitionValue(id).build()));
    }
}
