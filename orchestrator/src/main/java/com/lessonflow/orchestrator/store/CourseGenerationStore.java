package com.lessonflow.orchestrator.store;

import com.lessonflow.orchestrator.store.item.CourseGenerationItem;

/**
 * 코스 생성 결과 저장소 (중복 생성 방지 키 = (email, topic_id))
 */
public interface CourseGenerationStore {

    boolean exists(String ownerEmail, String topicId);

    /**
     * 같은 키가 없을 때만 저장
     *
     * @return false: 다른 요청이 먼저 저장함
     */
    boolean saveIfAbsent(CourseGenerationItem item);
}
