package com.my.todos.adapter.in.api;

public record TodoDto(String id,
                      String title,
                      PriorityDto priority,
                      StatusDto status,
                      long createdTimestamp,
                      long updatedTimestamp,
                      Long deadline) {
}
