package com.my.todos.adapter.in.api;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * 왜: 외부 검색 요청을 그대로 받아 두고, 도메인 {@code Query} 변환은 매퍼 한 곳에서만 하기 위함.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record QueryDto(String keyword,
                       PriorityDto priority,
                       StatusDto status,
                       String deadline,
                       QuerySortDto sort,
                       Long limit) {
}
