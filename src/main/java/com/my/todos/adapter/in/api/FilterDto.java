package com.my.todos.adapter.in.api;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * 왜: 개수 집계는 정렬/상한이 필요 없으므로 필터 조건만 받는 별도 계약을 둔다.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record FilterDto(String keyword, PriorityDto priority, StatusDto status, String deadline) {
}
