package com.my.todos.domain.exception;

public class TooLongTodoTitleException extends TodoException {

    private final String input;
    private final int expectedLen;

    public TooLongTodoTitleException(String input, int expectedLen) {
        super(ErrorKind.TOO_LONG_TODO_TITLE,
                "The provided title '" + input + "' exceeds max " + expectedLen + " characters.");
        this.input = input;
        this.expectedLen = expectedLen;
    }

    public String input() {
        return input;
    }

    public int expectedLen() {
        return expectedLen;
    }
}
