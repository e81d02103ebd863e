package io.github.drompincen.codeforge.protocol.api;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class TodoStatusTest {

    @Test
    void parsesWireNames() {
        assertThat(TodoStatus.fromWire("pending")).contains(TodoStatus.PENDING);
        assertThat(TodoStatus.fromWire("in_progress")).contains(TodoStatus.IN_PROGRESS);
        assertThat(TodoStatus.fromWire("Completed")).contains(TodoStatus.COMPLETED);
        assertThat(TodoStatus.fromWire("in-progress")).contains(TodoStatus.IN_PROGRESS);
    }

    @Test
    void rejectsUnknownValues() {
        assertThat(TodoStatus.fromWire("done")).isEmpty();
        assertThat(TodoStatus.fromWire(null)).isEmpty();
    }

    @Test
    void newTodoStartsPending() {
        TodoItem item = TodoItem.create("Write tests", null);

        assertThat(item.status()).isEqualTo(TodoStatus.PENDING);
        assertThat(item.description()).isEmpty();
        assertThat(item.withStatus(TodoStatus.COMPLETED).id()).isEqualTo(item.id());
    }

    @Test
    void serializesUsingWireNames() throws Exception {
        ObjectMapper mapper = new ObjectMapper();

        assertThat(mapper.writeValueAsString(TodoStatus.IN_PROGRESS)).isEqualTo("\"in_progress\"");
        assertThat(mapper.readValue("\"completed\"", TodoStatus.class)).isEqualTo(TodoStatus.COMPLETED);
    }
}
