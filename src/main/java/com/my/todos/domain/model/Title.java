package com.my.todos.domain.model;

import com.my.todos.domain.exception.EmptyTodoTitleException;
import com.my.todos.domain.exception.TooLongTodoTitleException;

import java.util.Objects;

/**
 * 왜: 제목 입력을 생성 시점에 정규화(앞뒤 공백 제거)하고, 저장 전 길이 규칙을 한 곳에서 검증하기 위함.
 */
public record Title(String value) {

    public static final int MAX_LEN = 20;

    public Title {
        Objects.requireNonNull(value, "value");
        value = value.strip();
    }

    public static Title of(String raw) {
        return new Title(raw);
    }

    /**
     * 정규화된 제목을 돌려준다. 길이는 코드 포인트 단위로 센다.
     *
     * @throws EmptyTodoTitleException    공백 제거 후 비어 있을 때
     * @throws TooLongTodoTitleException  {@link #MAX_LEN}을 넘을 때
     */
    public String validate() {
        int length = value.codePointCount(0, value.length());
        if (length < 1) {
            throw new EmptyTodoTitleException();
        }
        if (length > MAX_LEN) {
            throw new TooLongTodoTitleException(value, MAX_LEN);
        }
        return value;
    }
}
