package com.my.todos.adapter.in.api;

import com.my.todos.domain.exception.DataConversionException;
import com.my.todos.domain.exception.ErrorKind;
import com.my.todos.domain.exception.InvalidRequestException;
import com.my.todos.domain.exception.InvalidUuidException;
import com.my.todos.domain.model.Priority;
import com.my.todos.domain.model.Query;
import com.my.todos.domain.model.QuerySort;
import com.my.todos.domain.model.Status;
import com.my.todos.domain.model.UpdateTodo;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TodoDtoMapperTest {

    @ParameterizedTest
    @EnumSource(Priority.class)
    void priorityMappingIsSymmetric(Priority priority) {
        assertThat(TodoDtoMapper.toDomain(TodoDtoMapper.toWire(priority))).isEqualTo(priority);
    }

    @ParameterizedTest
    @EnumSource(Status.class)
    void statusMappingIsSymmetric(Status status) {
        assertThat(TodoDtoMapper.toDomain(TodoDtoMapper.toWire(status))).isEqualTo(status);
    }

    @Test
    void mappingDoesNotDependOnDeclarationOrder() {
        assertThat(TodoDtoMapper.toDomain(PriorityDto.HIGH)).isEqualTo(Priority.HIGH);
        assertThat(TodoDtoMapper.toDomain(PriorityDto.LOW)).isEqualTo(Priority.LOW);
        assertThat(TodoDtoMapper.toDomain(QuerySortDto.STATUS)).isEqualTo(QuerySort.STATUS);
    }

    @Test
    void parsesCanonicalUuid() {
        UUID id = UUID.randomUUID();

        assertThat(TodoDtoMapper.parseId(id.toString())).isEqualTo(id);
    }

    @ParameterizedTest
    @ValueSource(strings = {"", "abc", "1-1-1-1-1", "123e4567-e89b-12d3-a456-42661417400Z"})
    void rejectsInvalidUuid(String raw) {
        assertThatThrownBy(() -> TodoDtoMapper.parseId(raw))
                .isInstanceOfSatisfying(InvalidUuidException.class, e -> {
                    assertThat(e.raw()).isEqualTo(raw);
                    assertThat(e.kind()).isEqualTo(ErrorKind.INVALID_UUID);
                });
    }

    @Test
    void rejectsNegativeCount() {
        assertThat(TodoDtoMapper.toWireCount(7)).isEqualTo(7L);
        assertThatThrownBy(() -> TodoDtoMapper.toWireCount(-1))
                .isInstanceOfSatisfying(DataConversionException.class,
                        e -> assertThat(e.kind()).isEqualTo(ErrorKind.DATA_CONVERSION_USIZE_TO_U64));
    }

    @Test
    void updateDtoKeepsAbsentFieldsAbsent() {
        UpdateTodo change = TodoDtoMapper.toDomain(new UpdateTodoDto(null, PriorityDto.LOW, null, null));

        assertThat(change.titleChange()).isEmpty();
        assertThat(change.priorityChange()).contains(Priority.LOW);
        assertThat(change.statusChange()).isEmpty();
        assertThat(change.deadline().isPresent()).isFalse();
    }

    @Test
    void filterDtoCarriesNoSortOrLimit() {
        Query query = TodoDtoMapper.toDomain(new FilterDto("milk", null, StatusDto.DONE, "2022-01-01 00"));

        assertThat(query.keyword()).isEqualTo("milk");
        assertThat(query.status()).isEqualTo(Status.DONE);
        assertThat(query.sortBy()).isEmpty();
        assertThat(query.limit().value()).isNull();
    }

    @Test
    void newTodoRequiresPriority() {
        assertThatThrownBy(() -> TodoDtoMapper.toDomain(new NewTodoDto("abc", null, null)))
                .isInstanceOf(InvalidRequestException.class);
    }
}
