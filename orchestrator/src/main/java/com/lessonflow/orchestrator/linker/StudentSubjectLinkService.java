package com.lessonflow.orchestrator.linker;

import com.lessonflow.common.exception.BusinessException;
import com.lessonflow.common.exception.ErrorCode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * 여러 학생을 한 레슨에 연결
 *
 * 학생별 Link 결과를 updated / alreadyLinked / notFound로 분류한다.
 * 충돌 재시도까지 실패한 학생이 있으면 OptimisticLockingFailureException이 그대로 전파된다 (409).
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class StudentSubjectLinkService {

    private final SubjectListLinker linker;

    public BulkLinkReport linkStudents(String lessonUuid, List<String> studentEmails) {
        if (lessonUuid == null || lessonUuid.isBlank() || studentEmails == null || studentEmails.isEmpty()) {
            throw new BusinessException(ErrorCode.INVALID_INPUT,
                    "lesson_planner_UUID and student[] are required");
        }
        if (studentEmails.stream().anyMatch(email -> email == null || email.isBlank())) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "student[] must not contain empty entries");
        }

        List<String> updated = new ArrayList<>();
        List<String> alreadyLinked = new ArrayList<>();
        List<String> notFound = new ArrayList<>();

        for (String email : studentEmails) {
            LinkResult result = linker.link(email, lessonUuid);
            if (!result.found()) {
                notFound.add(email);
            } else if (result.added()) {
                updated.add(result.ownerKeyUsed());
            } else {
                alreadyLinked.add(result.ownerKeyUsed());
            }
        }

        log.info("일괄 연결 완료: lesson={}, updated={}, alreadyLinked={}, notFound={}",
                lessonUuid, updated.size(), alreadyLinked.size(), notFound.size());
        return new BulkLinkReport(lessonUuid, updated, alreadyLinked, notFound);
    }
}
