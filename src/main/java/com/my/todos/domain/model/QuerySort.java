package com.my.todos.domain.model;

/**
 * 왜: 검색 결과 정렬 기준을 명시적으로 고르게 하고, 지정하지 않으면 제목순으로 떨어지게 하기 위함.
 */
public enum QuerySort {
    DEADLINE,
    PRIORITY,
    STATUS
}
