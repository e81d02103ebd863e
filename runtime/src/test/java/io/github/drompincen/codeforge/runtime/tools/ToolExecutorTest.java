package io.github.drompincen.codeforge.runtime.tools;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.drompincen.codeforge.persistence.memory.MemoryStorage;
import io.github.drompincen.codeforge.persistence.project.ProjectRepository;
import io.github.drompincen.codeforge.protocol.api.FileChangeEvent;
import io.github.drompincen.codeforge.protocol.api.ToolCallResponse;
import io.github.drompincen.codeforge.runtime.todo.TodoStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@ExtendWith(MockitoExtension.class)
class ToolExecutorTest {

    @Mock private ProjectRepository projects;
    @Mock private MemoryStorage memories;

    private ToolRegistry registry;
    private ToolExecutor executor;

    @BeforeEach
    void setUp() {
        registry = new ToolRegistry();
        registry.register(new StubTool("write_note",
                ToolSchema.object()
                        .string("path", "Path", true)
                        .string("content", "Content", true)
                        .bool("overwrite", "Overwrite", false)
                        .build(),
                (ctx, args) -> {
                    boolean overwrite = args.optionalBoolean("overwrite", false);
                    ctx.fileChanged(FileChangeEvent.created(args.requireString("path"), args.requireString("content")));
                    return ToolResult.success("wrote " + args.requireString("path") + " overwrite=" + overwrite);
                }));
        registry.register(new StubTool("explode", ToolSchema.object().build(),
                (ctx, args) -> { throw new IllegalStateException("kaboom"); }));
        registry.register(new StubTool("read_line", ToolSchema.object().integer("line", "Line", true).build(),
                (ctx, args) -> ToolResult.success("line " + args.requireInt("line"))));
        executor = new ToolExecutor(registry, projects, memories, new TodoStore(), new ObjectMapper());
    }

    @Test
    void executesRegisteredToolRegardlessOfArgumentOrder() {
        ToolResult first = executor.execute("p1",
                call("write_note", "{\"path\":\"a.txt\",\"content\":\"x\"}"));
        ToolResult second = executor.execute("p1",
                call("write_note", "{\"content\":\"x\",\"path\":\"a.txt\"}"));

        assertThat(first).isEqualTo(second);
        assertThat(first.success()).isTrue();
        assertThat(first.output()).isEqualTo("wrote a.txt overwrite=false");
    }

    @Test
    void missingRequiredArgumentFailsFast() {
        ToolResult result = executor.execute("p1", call("write_note", "{\"path\":\"a.txt\"}"));

        assertThat(result.success()).isFalse();
        assertThat(result.error()).isEqualTo("Missing required argument: content");
    }

    @Test
    void nullArgumentCountsAsMissing() {
        ToolResult result = executor.execute("p1", call("write_note", "{\"path\":null,\"content\":\"x\"}"));

        assertThat(result.error()).isEqualTo("Missing required argument: path");
    }

    @Test
    void unknownToolReturnsFailureWithEmptyOutput() {
        ToolResult result = executor.execute("p1", call("launch_rocket", "{}"));

        assertThat(result).isEqualTo(new ToolResult(false, "", "Unknown tool: launch_rocket"));
    }

    @Test
    void malformedArgumentsAreReportedAsExecutionError() {
        ToolResult result = executor.execute("p1", call("write_note", "{\"path\": \"a.txt\", "));

        assertThat(result.success()).isFalse();
        assertThat(result.error()).startsWith("Error executing tool: ");
    }

    @Test
    void nonObjectArgumentsAreRejected() {
        ToolResult result = executor.execute("p1", call("write_note", "[1,2]"));

        assertThat(result.error()).isEqualTo("Error executing tool: arguments must be a JSON object");
    }

    @Test
    void blankArgumentsMeanNoArguments() {
        ToolResult result = executor.execute("p1", call("explode", ""));

        assertThat(result.error()).isEqualTo("Error executing tool: kaboom");
    }

    @Test
    void invalidArgumentTypeIsReported() {
        ToolResult ok = executor.execute("p1", call("read_line", "{\"line\":\"7\"}"));
        ToolResult bad = executor.execute("p1", call("read_line", "{\"line\":\"seven\"}"));

        assertThat(ok.output()).isEqualTo("line 7");
        assertThat(bad.error()).isEqualTo("Invalid argument 'line': expected an integer");
    }

    @Test
    void invalidBooleanIsReported() {
        ToolResult result = executor.execute("p1",
                call("write_note", "{\"path\":\"a\",\"content\":\"b\",\"overwrite\":\"maybe\"}"));

        assertThat(result.error()).isEqualTo("Invalid argument 'overwrite': expected a boolean");
    }

    @Test
    void fileChangesReachTheCallback() {
        List<FileChangeEvent> changes = new ArrayList<>();
        ToolInteractionCallback callback = new ToolInteractionCallback() {
            @Override
            public void onFileChanged(FileChangeEvent change) {
                changes.add(change);
            }
        };

        executor.execute("p1", call("write_note", "{\"path\":\"a.txt\",\"content\":\"x\"}"), callback);

        assertThat(changes).containsExactly(FileChangeEvent.created("a.txt", "x"));
    }

    @Test
    void defaultCallbackIsUsedWhenNoneGiven() {
        List<FileChangeEvent> changes = new ArrayList<>();
        executor.setInteractionCallback(new ToolInteractionCallback() {
            @Override
            public void onFileChanged(FileChangeEvent change) {
                changes.add(change);
            }
        });

        executor.execute("p1", call("write_note", "{\"path\":\"b.txt\",\"content\":\"y\"}"));

        assertThat(changes).hasSize(1);
    }

    private static ToolCallResponse call(String name, String arguments) {
        return new ToolCallResponse("call_1", name, arguments);
    }
}
