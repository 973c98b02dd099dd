package com.lessonflow.orchestrator.linker;

import com.lessonflow.orchestrator.store.StudentStore;
import com.lessonflow.orchestrator.store.item.StudentItem;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.Optional;

/**
 * 학생 subject_list에 레슨 UUID를 멱등하게 추가
 *
 * <pre>
 * 1. 주어진 키로 조회, 없고 소문자 키가 다르면 소문자 키로 한 번 더 조회
 * 2. 둘 다 없으면 NotFound
 * 3. 이미 포함 → 쓰지 않음 (added=false)
 * 4. 아니면 추가 후 "저장된 키"로 조건부 쓰기
 * </pre>
 *
 * version 충돌 시 다시 읽어서 1~4를 반복한다 (최대 {@value #MAX_ATTEMPTS}회).
 * 다시 읽었을 때 다른 요청이 이미 같은 값을 넣었다면 added=false로 끝난다.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class SubjectListLinker {

    static final int MAX_ATTEMPTS = 3;

    private final StudentStore studentStore;

    /**
     * @throws OptimisticLockingFailureException 모든 시도가 충돌한 경우
     */
    public LinkResult link(String ownerKey, String value) {
        OptimisticLockingFailureException lastConflict = null;

        for (int attempt = 1; attempt <= MAX_ATTEMPTS; attempt++) {
            Optional<StudentItem> found = lookup(ownerKey);
            if (found.isEmpty()) {
                log.info("[Link] 학생 레코드 없음: key={}", ownerKey);
                return LinkResult.notFound(ownerKey);
            }

            StudentItem student = found.get();
            if (student.hasSubject(value)) {
                log.debug("[Link] 이미 연결됨: key={}, value={}", student.getEmail(), value);
                return LinkResult.alreadyLinked(student.getEmail());
            }

            try {
                studentStore.updateSubjectList(student.withSubjectAppended(value));
                log.info("[Link] subject_list 추가: key={}, value={}", student.getEmail(), value);
                return LinkResult.added(student.getEmail());
            } catch (OptimisticLockingFailureException e) {
                log.warn("[Link] 충돌 - 재시도 {}/{}: key={}", attempt, MAX_ATTEMPTS, student.getEmail());
                lastConflict = e;
            }
        }

        throw lastConflict;
    }

    private Optional<StudentItem> lookup(String ownerKey) {
        Optional<StudentItem> found = studentStore.findByEmail(ownerKey);
        if (found.isPresent()) {
            return found;
        }

        String lowered = ownerKey.toLowerCase(Locale.ROOT);
        if (lowered.equals(ownerKey)) {
            return Optional.empty();
        }
        return studentStore.findByEmail(lowered);
    }
}
