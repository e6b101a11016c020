package com.my.todos.domain.model;

/**
 * 왜: 진행 상태를 닫힌 집합으로 표현하되 상태 간 전이 순서는 강제하지 않기 위함.
 */
public enum Status {
    BACKLOG,
    IN_PROGRESS,
    DONE
}
