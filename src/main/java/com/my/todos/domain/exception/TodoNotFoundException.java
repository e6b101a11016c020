package com.my.todos.domain.exception;

import java.util.UUID;

public class TodoNotFoundException extends TodoException {

    private final UUID id;

    public TodoNotFoundException(UUID id) {
        super(ErrorKind.TODO_NOT_FOUND, "Item with ID '" + id + "' not found.");
        this.id = id;
    }

    public UUID id() {
        return id;
    }
}
