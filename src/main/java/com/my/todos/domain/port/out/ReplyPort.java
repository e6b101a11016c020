package com.my.todos.domain.port.out;

import com.my.todos.domain.model.CommandReply;

/**
 * 왜: 응답 채널(RabbitMQ 등) 세부 구현을 숨기고 단일 계약으로 명령 결과를 돌려보내기 위함.
 */
public interface ReplyPort {
    void send(CommandReply reply);
}
