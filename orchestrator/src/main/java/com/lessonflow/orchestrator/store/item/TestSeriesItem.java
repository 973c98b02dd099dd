package com.lessonflow.orchestrator.store.item;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.NoArgsConstructor;
import lombok.Setter;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbAttribute;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbBean;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbPartitionKey;

/**
 * 공용(predefined) 테스트 시리즈 - Question 테이블, id 단일 키
 */
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
@DynamoDbBean
public class TestSeriesItem implements GenerationJobRecord {

    private String id;
    private Boolean generated;
    private String seriesTitle;

    @Override
    @DynamoDbPartitionKey
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
