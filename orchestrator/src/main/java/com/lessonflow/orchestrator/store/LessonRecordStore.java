package com.lessonflow.orchestrator.store;

import com.lessonflow.orchestrator.store.item.LessonRecordItem;

import java.util.Optional;

/**
 * 레슨 레코드 저장소
 */
public interface LessonRecordStore {

    void save(LessonRecordItem record);

    Optional<LessonRecordItem> findById(String id);
}
