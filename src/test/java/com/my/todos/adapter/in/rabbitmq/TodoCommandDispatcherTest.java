package com.my.todos.adapter.in.rabbitmq;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.my.todos.adapter.in.api.MetaDataDto;
import com.my.todos.adapter.in.api.TodoApi;
import com.my.todos.adapter.in.api.TodoDto;
import com.my.todos.config.TestAppConfig;
import com.my.todos.domain.exception.InvalidRequestException;
import com.my.todos.domain.exception.TodoNotFoundException;
import com.my.todos.domain.service.MutableClock;
import com.my.todos.domain.service.TodoStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TodoCommandDispatcherTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private TodoCommandDispatcher dispatcher;

    @BeforeEach
    void setUp() {
        TodoApi api = new TodoApi(new TodoStore(new MutableClock(0L)), new TestAppConfig());
        dispatcher = new TodoCommandDispatcher(api, objectMapper);
    }

    private IncomingCommand command(String json) throws Exception {
        return objectMapper.readValue(json, IncomingCommand.class);
    }

    private TodoDto add(String title, String priority) throws Exception {
        return (TodoDto) dispatcher.dispatch(command("{\"commandId\":\"c\",\"operation\":\"ADD\","
                + "\"payload\":{\"title\":\"" + title + "\",\"priority\":\"" + priority + "\"}}"));
    }

    @Test
    void addThenGet() throws Exception {
        TodoDto created = add("abc", "HIGH");

        Object fetched = dispatcher.dispatch(command(
                "{\"commandId\":\"c2\",\"operation\":\"GET\",\"id\":\"" + created.id() + "\"}"));

        assertThat(fetched).isEqualTo(created);
    }

    @Test
    void searchWithoutPayloadUsesDefaults() throws Exception {
        add("b", "LOW");
        add("a", "LOW");

        @SuppressWarnings("unchecked")
        List<TodoDto> found = (List<TodoDto>) dispatcher.dispatch(
                command("{\"commandId\":\"c\",\"operation\":\"SEARCH\"}"));

        assertThat(found).extracting(TodoDto::title).containsExactly("a", "b");
    }

    @Test
    void updateAndCount() throws Exception {
        TodoDto created = add("abc", "LOW");

        dispatcher.dispatch(command("{\"commandId\":\"c\",\"operation\":\"UPDATE\",\"id\":\"" + created.id()
                + "\",\"payload\":{\"status\":\"DONE\"}}"));
        Object count = dispatcher.dispatch(command(
                "{\"commandId\":\"c\",\"operation\":\"COUNT_BY\",\"payload\":{\"status\":\"DONE\"}}"));

        assertThat(count).isEqualTo(1L);
    }

    @Test
    void batchDeletes() throws Exception {
        TodoDto a = add("a", "LOW");
        add("b", "MEDIUM");
        add("c", "HIGH");

        assertThat(dispatcher.dispatch(command("{\"commandId\":\"c\",\"operation\":\"DELETE_BY_IDS\","
                + "\"payload\":[\"" + a.id() + "\"]}"))).isEqualTo(1L);
        assertThat(dispatcher.dispatch(command("{\"commandId\":\"c\",\"operation\":\"DELETE_BY_PRIORITIES\","
                + "\"payload\":[\"HIGH\"]}"))).isEqualTo(1L);
        assertThat(dispatcher.dispatch(command("{\"commandId\":\"c\",\"operation\":\"DELETE_BY_STATUSES\","
                + "\"payload\":[\"BACKLOG\"]}"))).isEqualTo(1L);
        assertThat(dispatcher.dispatch(command("{\"commandId\":\"c\",\"operation\":\"COUNT_ALL\"}")))
                .isEqualTo(0L);
    }

    @Test
    void deleteReturnsNothing() throws Exception {
        TodoDto a = add("a", "LOW");

        Object result = dispatcher.dispatch(command(
                "{\"commandId\":\"c\",\"operation\":\"DELETE\",\"id\":\"" + a.id() + "\"}"));

        assertThat(result).isNull();
        assertThatThrownBy(() -> dispatcher.dispatch(command(
                "{\"commandId\":\"c\",\"operation\":\"GET\",\"id\":\"" + a.id() + "\"}")))
                .isInstanceOf(TodoNotFoundException.class);
    }

    @Test
    void metaReturnsVersions() throws Exception {
        assertThat(dispatcher.dispatch(command("{\"commandId\":\"c\",\"operation\":\"META\"}")))
                .isEqualTo(new MetaDataDto("0.1.0", 1L));
    }

    @Test
    void rejectsMissingIdAndPayload() {
        assertThatThrownBy(() -> dispatcher.dispatch(command("{\"commandId\":\"c\",\"operation\":\"GET\"}")))
                .isInstanceOf(InvalidRequestException.class);
        assertThatThrownBy(() -> dispatcher.dispatch(command("{\"commandId\":\"c\",\"operation\":\"ADD\"}")))
                .isInstanceOf(InvalidRequestException.class);
        assertThatThrownBy(() -> dispatcher.dispatch(new IncomingCommand("c", "DELETE_BY_PRIORITIES", null,
                objectMapper.valueToTree(List.of("URGENT")))))
                .isInstanceOf(InvalidRequestException.class);
    }

    @Test
    void rejectsNullEntriesInBatchLists() throws Exception {
        add("a", "LOW");

        for (String operation : List.of("DELETE_BY_STATUSES", "DELETE_BY_PRIORITIES", "DELETE_BY_IDS")) {
            assertThatThrownBy(() -> dispatcher.dispatch(command(
                    "{\"commandId\":\"c\",\"operation\":\"" + operation + "\",\"payload\":[null]}")))
                    .isInstanceOf(InvalidRequestException.class)
                    .hasMessageContaining(operation);
        }
        assertThat(dispatcher.dispatch(command("{\"commandId\":\"c\",\"operation\":\"COUNT_ALL\"}")))
                .isEqualTo(1L);
    }
}
