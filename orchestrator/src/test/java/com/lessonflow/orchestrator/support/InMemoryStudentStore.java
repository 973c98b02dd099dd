package com.lessonflow.orchestrator.support;

import com.lessonflow.orchestrator.store.StudentStore;
import com.lessonflow.orchestrator.store.item.StudentItem;
import org.springframework.dao.OptimisticLockingFailureException;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Queue;

/**
 * DynamoDB 없이 version 조건부 쓰기를 흉내내는 학생 저장소
 *
 * interleave(): 다음 update 직전에 다른 요청의 쓰기를 끼워 넣어 충돌을 만든다.
 */
public class InMemoryStudentStore implements StudentStore {

    private final Map<String, StudentItem> records = new HashMap<>();
    private final Queue<Runnable> interleaved = new ArrayDeque<>();
    private int updateCount;

    public InMemoryStudentStore put(String email, String... subjects) {
        records.put(email, StudentItem.builder()
                .email(email)
                .subjectList(new ArrayList<>(List.of(subjects)))
                .build());
        return this;
    }

    public void interleave(Runnable concurrentWrite) {
        interleaved.add(concurrentWrite);
    }

    /**
     * 다른 요청이 먼저 쓴 것처럼 값을 추가하고 version을 올린다
     */
    public void appendAsOtherWriter(String email, String subject) {
        StudentItem current = records.get(email);
        StudentItem next = current.withSubjectAppended(subject);
        next.setVersion(nextVersion(current.getVersion()));
        records.put(email, next);
    }

    public List<String> subjectsOf(String email) {
        return records.get(email).getSubjectList();
    }

    public boolean contains(String email) {
        return records.containsKey(email);
    }

    public int updateCount() {
        return updateCount;
    }

    @Override
    public Optional<StudentItem> findByEmail(String email) {
        StudentItem stored = records.get(email);
        if (stored == null) {
            return Optional.empty();
        }
        return Optional.of(stored.toBuilder()
                .subjectList(stored.getSubjectList() == null ? null : new ArrayList<>(stored.getSubjectList()))
                .build());
    }

    @Override
    public void updateSubjectList(StudentItem student) {
        Runnable concurrentWrite = interleaved.poll();
        if (concurrentWrite != null) {
            concurrentWrite.run();
        }

        StudentItem stored = records.get(student.getEmail());
        if (stored == null || !Objects.equals(stored.getVersion(), student.getVersion())) {
            throw new OptimisticLockingFailureException("version mismatch: " + student.getEmail());
        }

        StudentItem next = student.toBuilder()
                .subjectList(new ArrayList<>(student.getSubjectList()))
                .version(nextVersion(student.getVersion()))
                .build();
        records.put(student.getEmail(), next);
        updateCount++;
    }

    private static Long nextVersion(Long version) {
        return version == null ? 1L : version + 1;
    }
}
