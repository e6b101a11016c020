package com.my.todos.domain.model;

/**
 * 왜: 중요도를 닫힌 열거형으로 두어 생성 시점에 별도 검증 없이 항상 유효한 값만 받기 위함.
 */
public enum Priority {
    LOW,
    MEDIUM,
    HIGH
}
