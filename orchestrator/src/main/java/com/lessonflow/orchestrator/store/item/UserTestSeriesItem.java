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
 * 사용자별 테스트 시리즈 - User_Infinite_TestSeries 테이블, (email, id) 복합 키
 */
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
@DynamoDbBean
public class UserTestSeriesItem implements GenerationJobRecord {

    private String email;
    private String id;
    private Boolean generated;
    private String seriesTitle;

    @DynamoDbPartitionKey
    @DynamoDbAttribute("email")
    public String getEmail() {
        return email;
    }

    @Override
    @DynamoDbSortKey
    @DynamoDbAttribute("id")
    public String getId() {
        return id;
    }

    @Override
    @DynamoDbAttribute("Generated")
    public Boolean getGenerated() {
        return generated;
    }

    @Override
    @DynamoDbAttribute("series_title")
    public String getSeriesTitle() {
        return seriesTitle;
    }
}
