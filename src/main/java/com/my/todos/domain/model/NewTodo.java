package com.my.todos.domain.model;

import java.util.Objects;

/**
 * 왜: 생성 요청의 원시 입력(제목, 마감 시각 문자열)을 검증 전 상태 그대로 저장소에 넘기기 위함.
 */
public record NewTodo(Title title, Priority priority, DeadlineInput deadline) {
    public NewTodo {
        Objects.requireNonNull(title, "title");
        Objects.requireNonNull(priority, "priority");
        deadline = deadline == null ? DeadlineInput.none() : deadline;
    }

    public NewTodo(String title, Priority priority) {
        this(Title.of(title), priority, DeadlineInput.none());
    }

    public NewTodo(String title, Priority priority, String deadline) {
        this(Title.of(title), priority, DeadlineInput.of(deadline));
    }
}
