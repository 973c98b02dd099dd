package com.lessonflow.orchestrator.client;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * 학생-과목 배정 결과
 *
 * @param assigned 응답 본문의 status가 "assigned"인 경우만 true
 * @param response 게이트웨이 응답 원문 (실패 리포트용, 없으면 null)
 */
public record AssignmentResult(boolean assigned, JsonNode response) {
}
