package com.lessonflow.orchestrator.store;

import com.lessonflow.orchestrator.store.item.StudentItem;

import java.util.Optional;

/**
 * 학생 레코드 저장소
 */
public interface StudentStore {

    /**
     * 저장된 키 그대로 조회 (대소문자 보정 없음)
     */
    Optional<StudentItem> findByEmail(String email);

    /**
     * subject_list 갱신. 읽은 시점의 version과 다르면 쓰지 않는다.
     *
     * @throws org.springframework.dao.OptimisticLockingFailureException version 충돌
     */
    void updateSubjectList(StudentItem student);
}
