package com.my.todos.adapter.in.api;

public enum PriorityDto {
    HIGH,
    MEDIUM,
    LOW
}
