package com.my.todos.domain.exception;

public class EmptyTodoTitleException extends TodoException {

    public EmptyTodoTitleException() {
        super(ErrorKind.EMPTY_TODO_TITLE, "Title cannot be empty.");
    }
}
