package com.lessonflow.orchestrator.store.item;

/**
 * 생성 잡(테스트 시리즈) 레코드 공통 뷰
 *
 * generated: true(완료) / false(생성 중) / null(레코드 손상)
 */
public interface GenerationJobRecord {

    String getId();

    Boolean getGenerated();

    String getSeriesTitle();
}
