package com.lessonflow.orchestrator.store.dynamodb;

import com.lessonflow.orchestrator.config.LessonflowProperties;
import com.lessonflow.orchestrator.store.StudentStore;
import com.lessonflow.orchestrator.store.item.StudentItem;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.stereotype.Repository;
import software.amazon.awssdk.enhanced.dynamodb.DynamoDbEnhancedClient;
import software.amazon.awssdk.enhanced.dynamodb.DynamoDbTable;
import software.amazon.awssdk.enhanced.dynamodb.Key;
import software.amazon.awssdk.enhanced.dynamodb.TableSchema;
import software.amazon.awssdk.enhanced.dynamodb.model.UpdateItemEnhancedRequest;
import software.amazon.awssdk.services.dynamodb.model.ConditionalCheckFailedException;

import java.util.Optional;

/**
 * Investor 테이블 어댑터
 *
 * updateItem + ignoreNulls: 매핑하지 않은 학생 속성은 건드리지 않는다.
 * version 조건은 VersionedRecordExtension이 붙인다.
 */
@Repository
@Slf4j
public class DynamoDbStudentStore implements StudentStore {

    private final DynamoDbTable<StudentItem> table;

    public DynamoDbStudentStore(DynamoDbEnhancedClient enhancedClient, LessonflowProperties properties) {
        this.table = enhancedClient.table(properties.getTables().getStudents(),
                TableSchema.fromBean(StudentItem.class));
    }

    @Override
    public Optional<StudentItem> findByEmail(String email) {
        return Optional.ofNullable(table.getItem(Key.builder().partitionValue(email).build()));
    }

    @Override
    public void updateSubjectList(StudentItem student) {
        try {
            table.updateItem(UpdateItemEnhancedRequest.builder(StudentItem.class)
                    .item(student)
                    .ignoreNulls(true)
                    .build());
        } catch (ConditionalCheckFailedException e) {
            log.warn("subject_list 조건부 쓰기 충돌: email={}, version={}", student.getEmail(), student.getVersion());
            throw new OptimisticLockingFailureException(
                    "Student record modified concurrently: " + student.getEmail(), e);
        }
    }
}
