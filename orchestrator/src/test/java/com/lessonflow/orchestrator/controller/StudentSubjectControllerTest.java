package com.lessonflow.orchestrator.controller;

import com.lessonflow.common.exception.GlobalExceptionHandler;
import com.lessonflow.orchestrator.linker.StudentSubjectLinkService;
import com.lessonflow.orchestrator.linker.SubjectListLinker;
import com.lessonflow.orchestrator.support.InMemoryStudentStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

class StudentSubjectControllerTest {

    private InMemoryStudentStore store;
    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        store = new InMemoryStudentStore();
        StudentSubjectLinkService service = new StudentSubjectLinkService(new SubjectListLinker(store));
        mockMvc = MockMvcBuilders.standaloneSetup(new StudentSubjectController(service))
                .setControllerAdvice(new GlobalExceptionHandler())
                .build();
    }

    @Test
    @DisplayName("학생별 분류 결과를 돌려준다")
    void updateStudentSubjects_reportsClassification() throws Exception {
        store.put("a@school.org");

        mockMvc.perform(post("/update_student_subjects").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"body\":{\"lesson_planner_UUID\":\"LP-1\",\"student\":[\"A@school.org\",\"x@school.org\"]}}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.lesson_planner_UUID").value("LP-1"))
                .andExpect(jsonPath("$.data.updated_students[0]").value("a@school.org"))
                .andExpect(jsonPath("$.data.not_found[0]").value("x@school.org"));
    }

    @Test
    @DisplayName("학생 목록이 비면 400")
    void updateStudentSubjects_requiresStudents() throws Exception {
        mockMvc.perform(post("/update_student_subjects").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"body\":{\"lesson_planner_UUID\":\"LP-1\",\"student\":[]}}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.errorInfo.code").value("COMMON_001"));
    }

    @Test
    @DisplayName("학생 목록에 null이 있으면 500이 아니라 400")
    void updateStudentSubjects_rejectsNullEntry() throws Exception {
        store.put("a@school.org");

        mockMvc.perform(post("/update_student_subjects").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"body\":{\"lesson_planner_UUID\":\"LP-1\",\"student\":[\"a@school.org\",null]}}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.errorInfo.code").value("COMMON_001"));
    }
}
