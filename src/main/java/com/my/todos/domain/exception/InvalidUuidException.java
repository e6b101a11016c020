package com.my.todos.domain.exception;

/**
 * 왜: 외부 식별자 문자열이 UUID로 해석되지 않을 때 원문을 보존해 어떤 입력이 문제였는지 알리기 위함.
 */
public class InvalidUuidException extends TodoException {

    private final String raw;

    public InvalidUuidException(String raw, Throwable cause) {
        super(ErrorKind.INVALID_UUID, "'" + raw + "' is NOT a valid UUID.", cause);
        this.raw = raw;
    }

    public String raw() {
        return raw;
    }
}
