package com.lessonflow.orchestrator.store.item;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.NoArgsConstructor;
import lombok.Setter;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbAttribute;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbBean;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbPartitionKey;
import software.amazon.awssdk.enhanced.dynamodb.extensions.annotations.DynamoDbVersionAttribute;

import java.util.ArrayList;
import java.util.List;

/**
 * 학생 레코드 - Investor 테이블 (이 서비스가 다루는 속성만 매핑)
 *
 * subject_list: 학생이 속한 레슨 UUID 목록, 같은 UUID는 한 번만 존재
 * version: 조건부 쓰기용. 기존 레코드에는 없을 수 있고 첫 쓰기에서 1로 설정된다.
 */
@Setter
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@DynamoDbBean
public class StudentItem {

    private String email;
    private List<String> subjectList;
    private Long version;

    @DynamoDbPartitionKey
    @DynamoDbAttribute("email")
    public String getEmail() {
        return email;
    }

    @DynamoDbAttribute("subject_list")
    public List<String> getSubjectList() {
        return subjectList;
    }

    @DynamoDbVersionAttribute
    @DynamoDbAttribute("version")
    public Long getVersion() {
        return version;
    }

    public boolean hasSubject(String lessonUuid) {
        return subjectList != null && subjectList.contains(lessonUuid);
    }

    /**
     * lessonUuid를 추가한 새 목록으로 복사본 생성 (원본 불변)
     */
    public StudentItem withSubjectAppended(String lessonUuid) {
        List<String> subjects = subjectList == null ? new ArrayList<>() : new ArrayList<>(subjectList);
        subjects.add(lessonUuid);
        return toBuilder().subjectList(subjects).build();
    }
}
