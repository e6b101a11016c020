package com.my.todos.adapter.in.rabbitmq;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.exc.ValueInstantiationException;
import com.my.todos.domain.exception.InvalidRequestException;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertThrows;

class IncomingCommandTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    @Test
    void mapsValidPayload() throws Exception {
        String payload = "{" +
                "\"commandId\":\"cmd-1\"," +
                "\"operation\":\"add\"," +
                "\"payload\":{\"title\":\"abc\",\"priority\":\"HIGH\"}," +
                "\"extra\":true" +
                "}";

        IncomingCommand command = objectMapper.readValue(payload, IncomingCommand.class);

        assertThat(command.commandId()).isEqualTo("cmd-1");
        assertThat(command.toOperation()).isEqualTo(TodoOperation.ADD);
        assertThat(command.hasPayload()).isTrue();
        assertThat(command.payload().get("title").asText()).isEqualTo("abc");
    }

    @Test
    void rejectsMissingFields() {
        String payload = "{\"operation\":\"GET\"}";

        assertThrows(ValueInstantiationException.class,
                () -> objectMapper.readValue(payload, IncomingCommand.class));
    }

    @Test
    void rejectsUnknownOperation() {
        IncomingCommand command = new IncomingCommand("cmd-1", "explode", null, null);

        assertThatThrownBy(command::toOperation)
                .isInstanceOf(InvalidRequestException.class)
                .hasMessageContaining("explode");
    }
}
