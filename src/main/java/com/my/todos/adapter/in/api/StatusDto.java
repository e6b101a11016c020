package com.my.todos.adapter.in.api;

public enum StatusDto {
    BACKLOG,
    IN_PROGRESS,
    DONE
}
