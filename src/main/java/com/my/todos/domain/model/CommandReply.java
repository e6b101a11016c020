package com.my.todos.domain.model;

import com.my.todos.domain.exception.TodoException;

import java.util.Objects;

/**
 * 왜: 명령 처리 결과를 성공/실패 여부와 함께 고정된 형태로 응답 채널에 넘기기 위함.
 * 실패 시 errorKind는 도메인 오류 종류의 표기이며, 도메인 밖 오류이면 null이다.
 */
public record CommandReply(String commandId, boolean success, Object result, String errorKind, String message) {
    public CommandReply {
        Objects.requireNonNull(commandId, "commandId");
    }

    public static CommandReply success(String commandId, Object result) {
        return new CommandReply(commandId, true, result, null, null);
    }

    public static CommandReply failure(String commandId, TodoException error) {
        return new CommandReply(commandId, false, null, error.kind().label(), error.getMessage());
    }

    public static CommandReply failure(String commandId, String message) {
        return new CommandReply(commandId, false, null, null, message);
    }
}
