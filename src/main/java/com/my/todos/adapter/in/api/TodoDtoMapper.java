package com.my.todos.adapter.in.api;

import com.my.todos.domain.exception.DataConversionException;
import com.my.todos.domain.exception.InvalidRequestException;
import com.my.todos.domain.exception.InvalidUuidException;
import com.my.todos.domain.model.DeadlineInput;
import com.my.todos.domain.model.NewTodo;
import com.my.todos.domain.model.Priority;
import com.my.todos.domain.model.Query;
import com.my.todos.domain.model.QuerySort;
import com.my.todos.domain.model.ResultLimit;
import com.my.todos.domain.model.Status;
import com.my.todos.domain.model.Title;
import com.my.todos.domain.model.Todo;
import com.my.todos.domain.model.UpdateTodo;

import java.util.Objects;
import java.util.UUID;
import java.util.regex.Pattern;

/**
 * 왜: 외부 DTO와 내부 타입 사이의 변환을 한 곳에 모은다. 열거형은 이름이나 순서를 재해석하지 않고
 * 모든 값을 switch로 명시적으로 대응시켜, 한쪽에 값이 추가되면 컴파일 단계에서 드러나게 한다.
 */
public final class TodoDtoMapper {

    private static final Pattern CANONICAL_UUID =
            Pattern.compile("[0-9a-fA-F]{8}-[0-9a-fA-F]{4}-[0-9a-fA-F]{4}-[0-9a-fA-F]{4}-[0-9a-fA-F]{12}");

    private TodoDtoMapper() {
    }

    public static UUID parseId(String raw) {
        if (raw == null || !CANONICAL_UUID.matcher(raw).matches()) {
            throw new InvalidUuidException(String.valueOf(raw), null);
        }
        try {
            return UUID.fromString(raw);
        } catch (IllegalArgumentException e) {
            throw new InvalidUuidException(raw, e);
        }
    }

    public static long toWireCount(int count) {
        if (count < 0) {
            throw DataConversionException.usizeToU64(count);
        }
        return count;
    }

    public static Priority toDomain(PriorityDto priority) {
        return switch (priority) {
            case HIGH -> Priority.HIGH;
            case MEDIUM -> Priority.MEDIUM;
            case LOW -> Priority.LOW;
        };
    }

    public static PriorityDto toWire(Priority priority) {
        return switch (priority) {
            case HIGH -> PriorityDto.HIGH;
            case MEDIUM -> PriorityDto.MEDIUM;
            case LOW -> PriorityDto.LOW;
        };
    }

    public static Status toDomain(StatusDto status) {
        return switch (status) {
            case BACKLOG -> Status.BACKLOG;
            case IN_PROGRESS -> Status.IN_PROGRESS;
            case DONE -> Status.DONE;
        };
    }

    public static StatusDto toWire(Status status) {
        return switch (status) {
            case BACKLOG -> StatusDto.BACKLOG;
            case IN_PROGRESS -> StatusDto.IN_PROGRESS;
            case DONE -> StatusDto.DONE;
        };
    }

    public static QuerySort toDomain(QuerySortDto sort) {
        return switch (sort) {
            case DEADLINE -> QuerySort.DEADLINE;
            case PRIORITY -> QuerySort.PRIORITY;
            case STATUS -> QuerySort.STATUS;
        };
    }

    public static NewTodo toDomain(NewTodoDto dto) {
        Objects.requireNonNull(dto, "dto");
        if (dto.priority() == null) {
            throw new InvalidRequestException("priority가 필요합니다.");
        }
        return new NewTodo(Title.of(nullToEmpty(dto.title())),
                toDomain(dto.priority()),
                DeadlineInput.of(dto.deadline()));
    }

    public static UpdateTodo toDomain(UpdateTodoDto dto) {
        Objects.requireNonNull(dto, "dto");
        return new UpdateTodo(
                dto.title() == null ? null : Title.of(dto.title()),
                dto.priority() == null ? null : toDomain(dto.priority()),
                dto.status() == null ? null : toDomain(dto.status()),
                DeadlineInput.of(dto.deadline()));
    }

    public static Query toDomain(QueryDto dto) {
        Objects.requireNonNull(dto, "dto");
        return new Query(dto.keyword(),
                dto.priority() == null ? null : toDomain(dto.priority()),
                dto.status() == null ? null : toDomain(dto.status()),
                DeadlineInput.of(dto.deadline()),
                dto.sort() == null ? null : toDomain(dto.sort()),
                ResultLimit.of(dto.limit()));
    }

    public static Query toDomain(FilterDto dto) {
        Objects.requireNonNull(dto, "dto");
        return new Query(dto.keyword(),
                dto.priority() == null ? null : toDomain(dto.priority()),
                dto.status() == null ? null : toDomain(dto.status()),
                DeadlineInput.of(dto.deadline()),
                null,
                ResultLimit.unset());
    }

    public static TodoDto toWire(Todo todo) {
        return new TodoDto(todo.id().toString(),
                todo.title(),
                toWire(todo.priority()),
                toWire(todo.status()),
                todo.createdTimestamp(),
                todo.updatedTimestamp(),
                todo.deadline());
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }
}
