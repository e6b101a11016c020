package com.my.todos.adapter.in.api;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record NewTodoDto(String title, PriorityDto priority, String deadline) {
}
