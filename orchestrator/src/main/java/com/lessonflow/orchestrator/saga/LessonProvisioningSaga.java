package com.lessonflow.orchestrator.saga;

import com.lessonflow.common.logging.RequestIdFilter;
import com.lessonflow.orchestrator.client.AssignmentResult;
import com.lessonflow.orchestrator.client.LessonPlannerGatewayClient;
import com.lessonflow.orchestrator.client.SchoolApiClient;
import com.lessonflow.orchestrator.client.SubjectRegistration;
import com.lessonflow.orchestrator.config.LessonflowProperties;
import com.lessonflow.orchestrator.dto.LessonPlannerPayload;
import com.lessonflow.orchestrator.dto.LessonProvisionRequest;
import com.lessonflow.orchestrator.linker.LinkResult;
import com.lessonflow.orchestrator.linker.SubjectListLinker;
import com.lessonflow.orchestrator.store.LessonRecordStore;
import com.lessonflow.orchestrator.store.item.LessonRecordItem;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * 레슨 프로비저닝 Saga
 *
 * <pre>
 * STEP 1: 레슨 레코드 생성          (실패 → Fatal, 이후 단계 없음)
 * STEP 2: 학교 조회 + 과목 등록     (실패 → Degraded, subjectId 없음)
 * STEP 3: 학생별 과목 배정          (subjectId와 학생이 있을 때만, 학생별 독립)
 * STEP 3b: 학생 subject_list 연결   (subjectId와 무관하게 실행)
 * STEP 4: 과목-교사 관계 등록       (subjectId와 teacherId가 있을 때만)
 * STEP 5: 레슨 플래너 payload 저장  (항상 시도)
 * </pre>
 *
 * 보상 트랜잭션은 없다. 이미 반영된 외부 상태는 되돌리지 않고,
 * 실패한 단계를 리포트에 남겨 호출자가 해당 단계만 재시도하게 한다.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class LessonProvisioningSaga {

    private static final DateTimeFormatter CREATED_AT_FORMAT =
            DateTimeFormatter.ofPattern("yyyy-MM-dd,HH:mm:ss").withZone(ZoneOffset.UTC);

    private final LessonRecordStore lessonRecordStore;
    private final SchoolApiClient schoolApiClient;
    private final LessonPlannerGatewayClient gatewayClient;
    private final SubjectListLinker subjectListLinker;
    private final LessonflowProperties properties;
    private final Clock clock;

    public ProvisionReport provision(LessonProvisionRequest request) {
        LessonPlannerPayload payload = request.body();
        String lessonUuid = payload.getLessonPlannerUuid();
        String tenantEmail = orDefault(request.tenantEmail(), properties.getTenant().getDefaultEmail());
        String tenantName = orDefault(request.tenantName(), properties.getTenant().getDefaultName());

        MDC.put(RequestIdFilter.MDC_WORKFLOW_ID, lessonUuid);
        try {
            log.info("========== 프로비저닝 시작 [lesson={}] ==========", lessonUuid);
            return run(request.subject(), tenantEmail, tenantName, payload);
        } finally {
            MDC.remove(RequestIdFilter.MDC_WORKFLOW_ID);
        }
    }

    private ProvisionReport run(String subject, String tenantEmail, String tenantName,
                                LessonPlannerPayload payload) {
        String lessonUuid = payload.getLessonPlannerUuid();

        // STEP 1: 레슨 레코드
        try {
            lessonRecordStore.save(buildLessonRecord(subject, tenantEmail, tenantName, payload));
            log.info("[STEP 1] 레슨 레코드 생성 완료");
        } catch (Exception e) {
            log.error("[STEP 1] 레슨 레코드 생성 실패 - 중단: {}", e.getMessage(), e);
            return ProvisionReport.fatal(lessonUuid,
                    new StepError(ProvisionStep.CREATE_LESSON_RECORD, e.getMessage()));
        }

        List<StepError> stepErrors = new ArrayList<>();

        // STEP 2: 과목 등록
        String subjectId = registerSubject(subject, tenantEmail, payload, stepErrors);

        // STEP 3: 학생 배정
        List<AssignedStudent> assigned = new ArrayList<>();
        List<String> notFound = new ArrayList<>();
        List<FailedAssignment> failed = new ArrayList<>();
        List<String> students = payload.getStudents() == null ? List.of() : payload.getStudents();

        if (subjectId != null && !students.isEmpty()) {
            for (String email : students) {
                assignStudent(email, subjectId, assigned, notFound, failed);
            }
            log.info("[STEP 3] 배정 결과: assigned={}, notFound={}, failed={}",
                    assigned.size(), notFound.size(), failed.size());
        } else {
            log.info("[STEP 3] 배정 생략 (subjectId 또는 학생 없음)");
        }

        // STEP 3b: subject_list 연결
        List<String> linked = linkStudents(lessonUuid, students, stepErrors);

        // STEP 4: 과목-교사 관계
        if (subjectId != null && payload.hasTeacher()) {
            try {
                gatewayClient.insertSubjectTeacher(subjectId, payload.getTeacherId());
                log.info("[STEP 4] 과목-교사 관계 등록 완료: subjectId={}, teacherId={}",
                        subjectId, payload.getTeacherId());
            } catch (Exception e) {
                log.warn("[STEP 4] 과목-교사 관계 등록 실패: {}", e.getMessage());
                stepErrors.add(new StepError(ProvisionStep.REGISTER_SUBJECT_TEACHER, e.getMessage()));
            }
        } else {
            log.info("[STEP 4] 과목-교사 관계 생략 (subjectId 또는 teacherId 없음)");
        }

        // STEP 5: payload 저장
        try {
            gatewayClient.insertLessonPlanner(payload);
            log.info("[STEP 5] 레슨 플래너 저장 완료");
        } catch (Exception e) {
            log.warn("[STEP 5] 레슨 플래너 저장 실패: {}", e.getMessage());
            stepErrors.add(new StepError(ProvisionStep.PERSIST_LESSON_PLANNER, e.getMessage()));
        }

        ProvisionReport report = new ProvisionReport(lessonUuid, subjectId, assigned, notFound, failed,
                linked, stepErrors, false);
        if (report.degraded()) {
            log.warn("========== 프로비저닝 부분 성공 [lesson={}, errors={}] ==========",
                    lessonUuid, stepErrors.size());
        } else {
            log.info("========== 프로비저닝 성공 [lesson={}] ==========", lessonUuid);
        }
        return report;
    }

    private LessonRecordItem buildLessonRecord(String subject, String tenantEmail, String tenantName,
                                               LessonPlannerPayload payload) {
        return LessonRecordItem.builder()
                .id(payload.getLessonPlannerUuid())
                .createdAt(CREATED_AT_FORMAT.format(clock.instant()))
                .grade(payload.gradeOrEmpty())
                .gradeAndSubject("TD: " + subject)
                .gradeAndSubjectUi(subject + " - Assignment")
                .status(LessonRecordItem.STATUS_ACTIVE)
                .subject(subject)
                .tenantEmail(tenantEmail)
                .tenantName(tenantName)
                .quizCredit(0)
                .courseCredit(0)
                .icon(properties.getTenant().getIcon())
                .period(payload.periodOrEmpty())
                .section(payload.sectionOrEmpty())
                .build();
    }

    private String registerSubject(String subject, String tenantEmail, LessonPlannerPayload payload,
                                   List<StepError> stepErrors) {
        try {
            Optional<String> schoolId = schoolApiClient.resolveSchoolId(tenantEmail);
            if (schoolId.isEmpty()) {
                log.warn("[STEP 2] 학교 없음: tenantEmail={}", tenantEmail);
                stepErrors.add(new StepError(ProvisionStep.REGISTER_SUBJECT,
                        "No school found for tenant " + tenantEmail));
                return null;
            }

            Optional<String> subjectId = schoolApiClient.insertSubject(new SubjectRegistration(
                    subject, payload.gradeOrEmpty(), payload.sectionOrEmpty(), payload.periodOrEmpty(),
                    schoolId.get()));
            if (subjectId.isEmpty()) {
                log.warn("[STEP 2] 과목 등록 응답에 inserted_subject_id 없음");
                stepErrors.add(new StepError(ProvisionStep.REGISTER_SUBJECT,
                        "inserted_subject_id missing in response"));
                return null;
            }

            log.info("[STEP 2] 과목 등록 완료: subjectId={}", subjectId.get());
            return subjectId.get();
        } catch (Exception e) {
            log.warn("[STEP 2] 과목 등록 실패: {}", e.getMessage());
            stepErrors.add(new StepError(ProvisionStep.REGISTER_SUBJECT, e.getMessage()));
            return null;
        }
    }

    /**
     * 학생 한 명 배정. 예외는 이 학생만 failed로 분류하고 삼킨다.
     */
    private void assignStudent(String email, String subjectId, List<AssignedStudent> assigned,
                               List<String> notFound, List<FailedAssignment> failed) {
        Optional<String> studentId;
        try {
            studentId = gatewayClient.findStudentId(email, properties.getGateway().getStudentSchoolId());
        } catch (Exception e) {
            log.warn("[STEP 3] 학생 조회 실패: email={}, 원인={}", email, e.getMessage());
            failed.add(new FailedAssignment(email, null, null, e.getMessage()));
            return;
        }

        if (studentId.isEmpty()) {
            log.info("[STEP 3] 학생 없음: email={}", email);
            notFound.add(email);
            return;
        }

        try {
            AssignmentResult result = gatewayClient.assignSubject(studentId.get(), subjectId);
            if (result.assigned()) {
                assigned.add(new AssignedStudent(email, studentId.get()));
                log.info("[STEP 3] 배정 완료: email={}, studentId={}", email, studentId.get());
            } else {
                failed.add(new FailedAssignment(email, studentId.get(), result.response(), null));
                log.warn("[STEP 3] 배정 실패: email={}, response={}", email, result.response());
            }
        } catch (Exception e) {
            log.warn("[STEP 3] 배정 호출 실패: email={}, 원인={}", email, e.getMessage());
            failed.add(new FailedAssignment(email, studentId.get(), null, e.getMessage()));
        }
    }

    private List<String> linkStudents(String lessonUuid, List<String> students, List<StepError> stepErrors) {
        List<String> linked = new ArrayList<>();
        for (String email : students) {
            try {
                LinkResult result = subjectListLinker.link(email, lessonUuid);
                if (result.found()) {
                    linked.add(result.ownerKeyUsed());
                } else {
                    log.info("[STEP 3b] 학생 레코드 없음 - 연결 생략: email={}", email);
                }
            } catch (Exception e) {
                log.warn("[STEP 3b] subject_list 연결 실패: email={}, 원인={}", email, e.getMessage());
                stepErrors.add(new StepError(ProvisionStep.LINK_STUDENT_SUBJECTS, email + ": " + e.getMessage()));
            }
        }
        return linked;
    }

    private static String orDefault(String value, String fallback) {
        return value == null || value.isBlank() ? fallback : value;
    }
}
