package com.my.todos.adapter.in.api;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record UpdateTodoDto(String title, PriorityDto priority, StatusDto status, String deadline) {
}
