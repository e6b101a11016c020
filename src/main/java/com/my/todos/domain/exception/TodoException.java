package com.my.todos.domain.exception;

import java.util.Objects;

/**
 * 왜: 도메인 실패를 종류(kind)와 함께 호출자에게 그대로 전달하고, 재시도나 로깅 판단은 상위 계층에 맡기기 위함.
 */
public abstract class TodoException extends RuntimeException {

    private final ErrorKind kind;

    protected TodoException(ErrorKind kind, String description) {
        super("[" + Objects.requireNonNull(kind, "kind").label() + "] " + description);
        this.kind = kind;
    }

    protected TodoException(ErrorKind kind, String description, Throwable cause) {
        super("[" + Objects.requireNonNull(kind, "kind").label() + "] " + description, cause);
        this.kind = kind;
    }

    public ErrorKind kind() {
        return kind;
    }
}
