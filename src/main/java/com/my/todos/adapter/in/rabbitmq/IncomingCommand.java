package com.my.todos.adapter.in.rabbitmq;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.JsonNode;
import com.my.todos.domain.exception.InvalidRequestException;

import java.util.Locale;
import java.util.Objects;

@JsonIgnoreProperties(ignoreUnknown = true)
public record IncomingCommand(String commandId,
                              String operation,
                              String id,
                              JsonNode payload) {

    public IncomingCommand {
        Objects.requireNonNull(commandId, "commandId");
        Objects.requireNonNull(operation, "operation");
        if (commandId.isBlank() || operation.isBlank()) {
            throw new InvalidRequestException("명령 필드가 비어 있습니다.");
        }
    }

    public TodoOperation toOperation() {
        try {
            return TodoOperation.valueOf(operation.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new InvalidRequestException("알 수 없는 연산입니다: " + operation, e);
        }
    }

    public boolean hasPayload() {
        return payload != null && !payload.isNull();
    }
}
