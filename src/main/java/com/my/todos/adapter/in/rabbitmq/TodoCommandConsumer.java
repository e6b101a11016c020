package com.my.todos.adapter.in.rabbitmq;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.my.todos.adapter.in.idempotency.IdempotencyStore;
import com.my.todos.domain.exception.InvalidRequestException;
import com.my.todos.domain.exception.TodoException;
import com.my.todos.domain.model.CommandReply;
import com.my.todos.domain.port.out.ReplyPort;
import io.smallrye.mutiny.Uni;
import io.smallrye.reactive.messaging.annotations.Blocking;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.reactive.messaging.Incoming;
import org.eclipse.microprofile.reactive.messaging.Message;
import org.jboss.logging.Logger;
import org.jboss.logging.MDC;

import java.io.IOException;

/**
 * 왜: RabbitMQ로 들어온 할 일 명령을 API 어댑터로 진입시키고, 결과를 응답 채널로 돌려보내는 단일 경로를 제공하기 위함.
 */
@ApplicationScoped
public class TodoCommandConsumer {

    private static final Logger log = Logger.getLogger(TodoCommandConsumer.class);

    private final TodoCommandDispatcher dispatcher;
    private final IdempotencyStore idempotencyStore;
    private final ReplyPort replyPort;
    private final ObjectMapper objectMapper;

    @Inject
    public TodoCommandConsumer(TodoCommandDispatcher dispatcher,
                               IdempotencyStore idempotencyStore,
                               ReplyPort replyPort,
                               ObjectMapper objectMapper) {
        this.dispatcher = dispatcher;
        this.idempotencyStore = idempotencyStore;
        this.replyPort = replyPort;
        this.objectMapper = objectMapper;
    }

    @Incoming("todo-commands")
    @Blocking
    public Uni<Void> consume(Message<String> message) {
        return Uni.createFrom().item(() -> {
            handle(message.getPayload());
            return null;
        }).replaceWithVoid();
    }

    void handle(String payload) {
        IncomingCommand command;
        try {
            command = objectMapper.readValue(payload, IncomingCommand.class);
        } catch (IOException | InvalidRequestException e) {
            log.warnf("명령 파싱 실패로 처리 중단: %s", e.getMessage());
            return;
        }
        MDC.put("commandId", command.commandId());
        MDC.put("operation", command.operation());
        try {
            if (idempotencyStore.isProcessed(command.commandId())) {
                log.infof("중복 명령을 건너뜁니다: %s", command.commandId());
                return;
            }
            log.debugf("명령 처리 시작: %s", command.operation());
            replyPort.send(execute(command));
            idempotencyStore.markProcessed(command.commandId());
        } finally {
            MDC.remove("commandId");
            MDC.remove("operation");
        }
    }

    private CommandReply execute(IncomingCommand command) {
        try {
            return CommandReply.success(command.commandId(), dispatcher.dispatch(command));
        } catch (TodoException e) {
            log.debugf("도메인 오류로 명령 실패: %s", e.kind().label());
            return CommandReply.failure(command.commandId(), e);
        } catch (InvalidRequestException e) {
            log.warnf("명령 검증 실패: %s", e.getMessage());
            return CommandReply.failure(command.commandId(), e.getMessage());
        }
    }
}
