package com.my.todos.domain.exception;

/**
 * 왜: 명령 메시지 자체가 계약을 위반했을 때(필드 누락, 알 수 없는 연산) 도메인 오류와 구분해 알리기 위함.
 */
public class InvalidRequestException extends RuntimeException {
    public InvalidRequestException(String message) {
        super(message);
    }

    public InvalidRequestException(String message, Throwable cause) {
        super(message, cause);
    }
}
