package com.lessonflow.orchestrator.store;

import com.lessonflow.orchestrator.store.item.GenerationJobRecord;

import java.util.Optional;

/**
 * 테스트 시리즈 생성 상태 조회 (읽기 전용, 쓰기는 외부 생성기가 한다)
 */
public interface TestSeriesStore {

    Optional<GenerationJobRecord> findPredefined(String jobId);

    Optional<GenerationJobRecord> findUserScoped(String userEmail, String jobId);
}
