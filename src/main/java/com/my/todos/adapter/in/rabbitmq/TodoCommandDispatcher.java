package com.my.todos.adapter.in.rabbitmq;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.my.todos.adapter.in.api.FilterDto;
import com.my.todos.adapter.in.api.NewTodoDto;
import com.my.todos.adapter.in.api.PriorityDto;
import com.my.todos.adapter.in.api.QueryDto;
import com.my.todos.adapter.in.api.StatusDto;
import com.my.todos.adapter.in.api.TodoApi;
import com.my.todos.adapter.in.api.UpdateTodoDto;
import com.my.todos.domain.exception.InvalidRequestException;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import java.io.IOException;
import java.util.List;

/**
 * 왜: 명령 종류별로 페이로드를 DTO로 읽어 API 어댑터의 해당 연산에 연결하는 분기를 소비자와 분리하기 위함.
 */
@ApplicationScoped
public class TodoCommandDispatcher {

    private static final TypeReference<List<StatusDto>> STATUS_LIST = new TypeReference<>() {
    };
    private static final TypeReference<List<PriorityDto>> PRIORITY_LIST = new TypeReference<>() {
    };
    private static final TypeReference<List<String>> ID_LIST = new TypeReference<>() {
    };

    private final TodoApi todoApi;
    private final ObjectMapper objectMapper;

    @Inject
    public TodoCommandDispatcher(TodoApi todoApi, ObjectMapper objectMapper) {
        this.todoApi = todoApi;
        this.objectMapper = objectMapper;
    }

    public Object dispatch(IncomingCommand command) {
        return switch (command.toOperation()) {
            case ADD -> todoApi.add(requirePayload(command, NewTodoDto.class));
            case UPDATE -> todoApi.update(requireId(command), requirePayload(command, UpdateTodoDto.class));
            case SEARCH -> todoApi.search(optionalPayload(command, QueryDto.class,
                    new QueryDto(null, null, null, null, null, null)));
            case COUNT_BY -> todoApi.countBy(optionalPayload(command, FilterDto.class,
                    new FilterDto(null, null, null, null)));
            case COUNT_ALL -> todoApi.countAll();
            case GET -> todoApi.get(requireId(command));
            case DELETE -> {
                todoApi.delete(requireId(command));
                yield null;
            }
            case DELETE_DONE -> todoApi.deleteDoneItems();
            case DELETE_BY_STATUSES -> todoApi.deleteByStatuses(requireList(command, STATUS_LIST));
            case DELETE_BY_PRIORITIES -> todoApi.deleteByPriorities(requireList(command, PRIORITY_LIST));
            case DELETE_BY_IDS -> todoApi.deleteByIds(requireList(command, ID_LIST));
            case DELETE_ALL -> todoApi.deleteAll();
            case META -> todoApi.meta();
        };
    }

    private String requireId(IncomingCommand command) {
        if (command.id() == null) {
            throw new InvalidRequestException(command.operation() + " 명령에는 id가 필요합니다.");
        }
        return command.id();
    }

    private <T> T requirePayload(IncomingCommand command, Class<T> type) {
        if (!command.hasPayload()) {
            throw new InvalidRequestException(command.operation() + " 명령에는 payload가 필요합니다.");
        }
        return readPayload(command, type);
    }

    private <T> T optionalPayload(IncomingCommand command, Class<T> type, T fallback) {
        return command.hasPayload() ? readPayload(command, type) : fallback;
    }

    private <T> T readPayload(IncomingCommand command, Class<T> type) {
        try {
            return objectMapper.treeToValue(command.payload(), type);
        } catch (JsonProcessingException e) {
            throw new InvalidRequestException("payload 형식이 올바르지 않습니다: " + command.operation(), e);
        }
    }

    private <T> List<T> requireList(IncomingCommand command, TypeReference<List<T>> type) {
        if (!command.hasPayload()) {
            throw new InvalidRequestException(command.operation() + " 명령에는 payload 목록이 필요합니다.");
        }
        List<T> values;
        try {
            values = objectMapper.readerFor(type).readValue(command.payload());
        } catch (IOException e) {
            throw new InvalidRequestException("payload 목록 형식이 올바르지 않습니다: " + command.operation(), e);
        }
        if (values.contains(null)) {
            throw new InvalidRequestException("payload 목록에 null 항목이 있습니다: " + command.operation());
        }
        return values;
    }
}
