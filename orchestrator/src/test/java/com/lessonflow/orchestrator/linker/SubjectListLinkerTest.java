package com.lessonflow.orchestrator.linker;

import com.lessonflow.orchestrator.support.InMemoryStudentStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.dao.OptimisticLockingFailureException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SubjectListLinkerTest {

    private static final String LESSON = "lesson-uuid-1";

    private InMemoryStudentStore store;
    private SubjectListLinker linker;

    @BeforeEach
    void setUp() {
        store = new InMemoryStudentStore();
        linker = new SubjectListLinker(store);
    }

    @Test
    @DisplayName("값이 없으면 추가하고 저장된 키로 쓴다")
    void link_appendsValue() {
        // given
        store.put("alice@school.org", "other-lesson");

        // when
        LinkResult result = linker.link("alice@school.org", LESSON);

        // then
        assertThat(result).isEqualTo(LinkResult.added("alice@school.org"));
        assertThat(store.subjectsOf("alice@school.org")).containsExactly("other-lesson", LESSON);
    }

    @Test
    @DisplayName("같은 값으로 두 번 연결해도 목록에는 한 번만 남고 두 번째는 쓰지 않는다")
    void link_twice_isIdempotent() {
        // given
        store.put("alice@school.org");

        // when
        LinkResult first = linker.link("alice@school.org", LESSON);
        LinkResult second = linker.link("alice@school.org", LESSON);

        // then
        assertThat(first.added()).isTrue();
        assertThat(second.found()).isTrue();
        assertThat(second.added()).isFalse();
        assertThat(store.subjectsOf("alice@school.org")).containsExactly(LESSON);
        assertThat(store.updateCount()).isEqualTo(1);
    }

    @Test
    @DisplayName("대소문자가 다른 키로 요청하면 소문자 키로 다시 찾아 그 키에 쓴다")
    void link_fallsBackToLowercaseKey() {
        // given
        store.put("alice@school.org");

        // when
        LinkResult result = linker.link("Alice@School.org", LESSON);

        // then
        assertThat(result.found()).isTrue();
        assertThat(result.added()).isTrue();
        assertThat(result.ownerKeyUsed()).isEqualTo("alice@school.org");
        assertThat(store.contains("Alice@School.org")).isFalse();
        assertThat(store.subjectsOf("alice@school.org")).containsExactly(LESSON);
    }

    @Test
    @DisplayName("원래 키와 소문자 키 모두 없으면 NotFound, 예외 아님")
    void link_missingRecord_returnsNotFound() {
        // when
        LinkResult result = linker.link("Ghost@School.org", LESSON);

        // then
        assertThat(result).isEqualTo(LinkResult.notFound("Ghost@School.org"));
        assertThat(store.updateCount()).isZero();
    }

    @Test
    @DisplayName("쓰기 직전 다른 요청이 목록을 바꾸면 다시 읽어 두 값 모두 보존한다")
    void link_concurrentWrite_retriesWithoutLosingUpdate() {
        // given
        store.put("alice@school.org");
        store.interleave(() -> store.appendAsOtherWriter("alice@school.org", "lesson-from-other-request"));

        // when
        LinkResult result = linker.link("alice@school.org", LESSON);

        // then
        assertThat(result.added()).isTrue();
        assertThat(store.subjectsOf("alice@school.org"))
                .containsExactly("lesson-from-other-request", LESSON);
    }

    @Test
    @DisplayName("다른 요청이 같은 값을 먼저 넣었으면 재조회 후 added=false")
    void link_concurrentSameValue_endsAsAlreadyLinked() {
        // given
        store.put("alice@school.org");
        store.interleave(() -> store.appendAsOtherWriter("alice@school.org", LESSON));

        // when
        LinkResult result = linker.link("alice@school.org", LESSON);

        // then
        assertThat(result.found()).isTrue();
        assertThat(result.added()).isFalse();
        assertThat(store.subjectsOf("alice@school.org")).containsExactly(LESSON);
    }

    @Test
    @DisplayName("모든 시도가 충돌하면 OptimisticLockingFailureException")
    void link_conflictOnEveryAttempt_throws() {
        // given
        store.put("alice@school.org");
        for (int i = 0; i < SubjectListLinker.MAX_ATTEMPTS; i++) {
            int n = i;
            store.interleave(() -> store.appendAsOtherWriter("alice@school.org", "other-" + n));
        }

        // when & then
        assertThatThrownBy(() -> linker.link("alice@school.org", LESSON))
                .isInstanceOf(OptimisticLockingFailureException.class);
        assertThat(store.subjectsOf("alice@school.org")).doesNotContain(LESSON);
    }
}
