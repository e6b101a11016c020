package com.my.todos.adapter.in.api;

public enum QuerySortDto {
    DEADLINE,
    PRIORITY,
    STATUS
}
