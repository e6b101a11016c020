package com.my.todos.domain.exception;

public class UpdateHasNoChangesException extends TodoException {

    public UpdateHasNoChangesException() {
        super(ErrorKind.UPDATE_HAS_NO_CHANGES, "At least one change must be present.");
    }
}
