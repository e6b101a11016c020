package com.my.todos.adapter.in.rabbitmq;

/**
 * 왜: 메시지로 들어오는 명령 종류를 닫힌 집합으로 고정해 디스패치 분기를 컴파일 단계에서 빠짐없이 다루기 위함.
 */
public enum TodoOperation {
    ADD,
    UPDATE,
    SEARCH,
    COUNT_BY,
    COUNT_ALL,
    GET,
    DELETE,
    DELETE_DONE,
    DELETE_BY_STATUSES,
    DELETE_BY_PRIORITIES,
    DELETE_BY_IDS,
    DELETE_ALL,
    META
}
