package io.github.drompincen.codeforge.runtime.agent;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.drompincen.codeforge.persistence.memory.MemoryStorage;
import io.github.drompincen.codeforge.persistence.project.ProjectRepository;
import io.github.drompincen.codeforge.protocol.api.ChatMessage;
import io.github.drompincen.codeforge.protocol.api.FileChangeEvent;
import io.github.drompincen.codeforge.protocol.api.ToolCall;
import io.github.drompincen.codeforge.protocol.api.ToolCallResponse;
import io.github.drompincen.codeforge.protocol.content.ContentBlock;
import io.github.drompincen.codeforge.protocol.content.DiffStats;
import io.github.drompincen.codeforge.protocol.event.ErrorCategory;
import io.github.drompincen.codeforge.protocol.event.StreamEvent;
import io.github.drompincen.codeforge.runtime.content.ContentSegmenter;
import io.github.drompincen.codeforge.runtime.llm.ProviderClient;
import io.github.drompincen.codeforge.runtime.lock.ProjectLockService;
import io.github.drompincen.codeforge.runtime.todo.TodoStore;
import io.github.drompincen.codeforge.runtime.tools.Tool;
import io.github.drompincen.codeforge.runtime.tools.ToolArguments;
import io.github.drompincen.codeforge.runtime.tools.ToolCategory;
import io.github.drompincen.codeforge.runtime.tools.ToolContext;
import io.github.drompincen.codeforge.runtime.tools.ToolExecutor;
import io.github.drompincen.codeforge.runtime.tools.ToolInteractionCallback;
import io.github.drompincen.codeforge.runtime.tools.ToolRegistry;
import io.github.drompincen.codeforge.runtime.tools.ToolResult;
import io.github.drompincen.codeforge.runtime.tools.ToolSchema;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.core.publisher.Flux;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.function.BiFunction;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class AgentLoopTest {

    private static final String PROJECT = "p1";

    @Mock private ProviderClient providerClient;
    @Mock private ProjectLockService lockService;
    @Mock private ProjectRepository projects;
    @Mock private MemoryStorage memories;

    private final TodoStore todoStore = new TodoStore();
    private final List<String> executed = new CopyOnWriteArrayList<>();
    private ToolRegistry registry;

    @BeforeEach
    void setUp() {
        lenient().when(lockService.tryAcquire(PROJECT)).thenReturn(Optional.of("owner-1"));
        registry = new ToolRegistry();
        registry.register(tool("echo", ToolSchema.object().string("text", "Text", true).build(), (ctx, args) -> {
            executed.add(args.requireString("text"));
            return ToolResult.success(args.requireString("text"));
        }));
        registry.register(tool("edit", ToolSchema.object().build(), (ctx, args) -> {
            ctx.fileChanged(FileChangeEvent.modified("a.txt", "one\ntwo", "one\nthree"));
            return ToolResult.success("File updated successfully: a.txt");
        }));
        registry.register(tool("finish_task", ToolSchema.object().string("summary", "Summary", true).build(),
                (ctx, args) -> {
                    ctx.callback().onTaskFinished(args.requireString("summary"));
                    return ToolResult.success("Task finished: " + args.requireString("summary"));
                }));
    }

    @Test
    void plainAnswerCompletesInOneIteration() {
        when(providerClient.streamChat(any())).thenReturn(Flux.just(
                StreamEvent.started(), new StreamEvent.ContentDelta("Hel"), new StreamEvent.ContentDelta("lo"),
                new StreamEvent.FinishReason("stop"), StreamEvent.completed()));

        AgentRunResult result = loop(AgentProperties.defaults()).run(PROJECT, history(), null, null);

        assertThat(result.status()).isEqualTo(AgentRunResult.Status.COMPLETED);
        assertThat(result.transcript()).isEqualTo("Hello");
        assertThat(result.iterations()).isEqualTo(1);
        assertThat(result.messages()).containsExactly(ChatMessage.user("Say hello"), ChatMessage.assistant("Hello"));
        verify(lockService).release(PROJECT, "owner-1");
    }

    @Test
    void toolCallsRunInOrderAndResultsAreFedBack() {
        when(providerClient.streamChat(any())).thenReturn(
                Flux.just(new StreamEvent.ContentDelta("Working"),
                        new StreamEvent.FinishReason("tool_calls"),
                        new StreamEvent.ToolCalls(List.of(
                                new ToolCallResponse("call_1", "echo", "{\"text\":\"first\"}"),
                                new ToolCallResponse("call_2", "echo", "{\"text\":\"second\"}"))),
                        StreamEvent.completed()),
                Flux.just(new StreamEvent.ContentDelta("Done"), StreamEvent.completed()));

        AgentRunResult result = loop(AgentProperties.defaults()).run(PROJECT, history(), null, null);

        assertThat(result.status()).isEqualTo(AgentRunResult.Status.COMPLETED);
        assertThat(result.iterations()).isEqualTo(2);
        assertThat(executed).containsExactly("first", "second");

        List<ChatMessage> messages = result.messages();
        assertThat(messages).extracting(ChatMessage::role)
                .containsExactly("user", "assistant", "tool", "tool", "assistant");
        assertThat(messages.get(1).toolCalls()).extracting(ToolCall::id).containsExactly("call_1", "call_2");
        assertThat(messages.get(2)).isEqualTo(ChatMessage.toolResult("call_1", "echo", "first"));
        assertThat(messages.get(3)).isEqualTo(ChatMessage.toolResult("call_2", "echo", "second"));
        assertThat(result.transcript())
                .isEqualTo("Working\n\n🔧 **echo**\n✅ first\n\n🔧 **echo**\n✅ second\n\nDone");
        verify(providerClient, times(2)).streamChat(any());
    }

    @Test
    void toolFailuresAreReportedToTheModel() {
        when(providerClient.streamChat(any())).thenReturn(
                Flux.just(new StreamEvent.ToolCalls(List.of(
                                new ToolCallResponse("call_1", "launch_rocket", "{}"),
                                new ToolCallResponse("call_2", "echo", "{}"))),
                        StreamEvent.completed()),
                Flux.just(new StreamEvent.ContentDelta("Sorry"), StreamEvent.completed()));

        AgentRunResult result = loop(AgentProperties.defaults()).run(PROJECT, history(), null, null);

        assertThat(result.messages().get(2).content()).isEqualTo("Error: Unknown tool: launch_rocket");
        assertThat(result.messages().get(3).content()).isEqualTo("Error: Missing required argument: text");
        assertThat(result.transcript()).startsWith("\n\n🔧 **launch_rocket**\n❌ Unknown tool: launch_rocket");
    }

    @Test
    void finishTaskEndsTheRun() {
        List<String> summaries = new ArrayList<>();
        ToolInteractionCallback callback = new ToolInteractionCallback() {
            @Override
            public void onTaskFinished(String summary) {
                summaries.add(summary);
            }
        };
        when(providerClient.streamChat(any())).thenReturn(Flux.just(
                new StreamEvent.ToolCalls(List.of(
                        new ToolCallResponse("call_1", "finish_task", "{\"summary\":\"Built the page\"}"))),
                StreamEvent.completed()));

        AgentRunResult result = loop(AgentProperties.defaults()).run(PROJECT, history(), callback, null);

        assertThat(result.status()).isEqualTo(AgentRunResult.Status.FINISHED);
        assertThat(result.summary()).isEqualTo("Built the page");
        assertThat(summaries).containsExactly("Built the page");
        verify(providerClient, times(1)).streamChat(any());
    }

    @Test
    void fileChangesAddDiffStatsToTheMarker() {
        when(providerClient.streamChat(any())).thenReturn(
                Flux.just(new StreamEvent.ToolCalls(List.of(new ToolCallResponse("call_1", "edit", "{}"))),
                        StreamEvent.completed()),
                Flux.just(StreamEvent.completed()));
        List<List<ContentBlock>> renders = new CopyOnWriteArrayList<>();
        AgentListener listener = new AgentListener() {
            @Override
            public void onContent(String transcript, List<ContentBlock> blocks) {
                renders.add(blocks);
            }
        };

        AgentRunResult result = loop(AgentProperties.defaults()).run(PROJECT, history(), null, listener);

        assertThat(result.transcript()).isEqualTo("\n\n🔧 **edit**\n✅ File updated successfully: a.txt (+1 -1)");
        List<ContentBlock> last = renders.get(renders.size() - 1);
        assertThat(last).hasSize(1);
        ContentBlock.ToolCallBlock block = (ContentBlock.ToolCallBlock) last.get(0);
        assertThat(block.diffStats()).isEqualTo(new DiffStats(1, 1));
    }

    @Test
    void nonRetriableErrorFailsTheRun() {
        StreamEvent.Error error = new StreamEvent.Error("Invalid API key. Please check your API key in Settings.",
                ErrorCategory.INVALID_CREDENTIALS);
        when(providerClient.streamChat(any())).thenReturn(Flux.just(StreamEvent.started(), error));
        List<StreamEvent.Error> reported = new ArrayList<>();
        AgentListener listener = new AgentListener() {
            @Override
            public void onError(StreamEvent.Error e) {
                reported.add(e);
            }
        };

        AgentRunResult result = loop(AgentProperties.defaults()).run(PROJECT, history(), null, listener);

        assertThat(result.status()).isEqualTo(AgentRunResult.Status.FAILED);
        assertThat(result.error()).isEqualTo(error);
        assertThat(reported).containsExactly(error);
        verify(providerClient, times(1)).streamChat(any());
    }

    @Test
    void retriableErrorBeforeAnyOutputIsRetried() {
        when(providerClient.streamChat(any())).thenReturn(
                Flux.just(new StreamEvent.Error("Rate limit exceeded. Please try again later.",
                        ErrorCategory.RATE_LIMITED)),
                Flux.just(new StreamEvent.ContentDelta("ok"), StreamEvent.completed()));

        AgentRunResult result = loop(new AgentProperties(25, 2, Duration.ofMillis(1), null, null))
                .run(PROJECT, history(), null, null);

        assertThat(result.status()).isEqualTo(AgentRunResult.Status.COMPLETED);
        assertThat(result.transcript()).isEqualTo("ok");
        verify(providerClient, times(2)).streamChat(any());
    }

    @Test
    void retriableErrorAfterOutputIsNotRetried() {
        when(providerClient.streamChat(any())).thenReturn(Flux.just(new StreamEvent.ContentDelta("half"),
                new StreamEvent.Error("Connection reset", ErrorCategory.NETWORK)));

        AgentRunResult result = loop(new AgentProperties(25, 2, Duration.ofMillis(1), null, null))
                .run(PROJECT, history(), null, null);

        assertThat(result.status()).isEqualTo(AgentRunResult.Status.FAILED);
        verify(providerClient, times(1)).streamChat(any());
    }

    @Test
    void busyWhenAnotherRunHoldsTheLock() {
        when(lockService.tryAcquire("p2")).thenReturn(Optional.empty());

        AgentRunResult result = loop(AgentProperties.defaults()).run("p2", history(), null, null);

        assertThat(result.status()).isEqualTo(AgentRunResult.Status.BUSY);
        verifyNoInteractions(providerClient);
        verify(lockService, never()).release(any(), any());
    }

    @Test
    void streamEndingWithoutTerminalEventIsCancelled() {
        when(providerClient.streamChat(any())).thenReturn(Flux.just(new StreamEvent.ContentDelta("partial")));

        AgentRunResult result = loop(AgentProperties.defaults()).run(PROJECT, history(), null, null);

        assertThat(result.status()).isEqualTo(AgentRunResult.Status.CANCELLED);
        assertThat(result.transcript()).isEqualTo("partial");
    }

    @Test
    void stopCancelsAnActiveStream() throws Exception {
        when(providerClient.streamChat(any())).thenReturn(
                Flux.concat(Flux.just(new StreamEvent.ContentDelta("thinking...")), Flux.never()));
        CountDownLatch streaming = new CountDownLatch(1);
        AgentListener listener = new AgentListener() {
            @Override
            public void onContent(String transcript, List<ContentBlock> blocks) {
                streaming.countDown();
            }
        };
        AgentLoop loop = loop(AgentProperties.defaults());

        Future<AgentRunResult> future = loop.startAsync(PROJECT, history(), null, listener);
        assertThat(streaming.await(5, TimeUnit.SECONDS)).isTrue();
        assertThat(loop.isRunning(PROJECT)).isTrue();
        loop.stop(PROJECT);

        AgentRunResult result = future.get(5, TimeUnit.SECONDS);
        assertThat(result.status()).isEqualTo(AgentRunResult.Status.CANCELLED);
        assertThat(loop.isRunning(PROJECT)).isFalse();
        verify(lockService).release(PROJECT, "owner-1");
    }

    @Test
    void iterationLimitStopsEndlessToolUse() {
        when(providerClient.streamChat(any())).thenAnswer(inv -> Flux.just(
                new StreamEvent.ToolCalls(List.of(new ToolCallResponse("call_1", "echo", "{\"text\":\"again\"}"))),
                StreamEvent.completed()));

        AgentRunResult result = loop(new AgentProperties(3, 0, null, null, null)).run(PROJECT, history(), null, null);

        assertThat(result.status()).isEqualTo(AgentRunResult.Status.MAX_ITERATIONS);
        assertThat(result.iterations()).isEqualTo(3);
        assertThat(executed).hasSize(3);
    }

    @Test
    void reasoningIsShownButKeptOutOfHistory() {
        when(providerClient.streamChat(any())).thenReturn(Flux.just(
                new StreamEvent.ContentDelta("<reasoning>Plan a greeting"),
                new StreamEvent.ContentDelta("</reasoning>\n\nHello"),
                StreamEvent.completed()));

        AgentRunResult result = loop(AgentProperties.defaults()).run(PROJECT, history(), null, null);

        assertThat(result.transcript()).isEqualTo("<reasoning>Plan a greeting</reasoning>\n\nHello");
        assertThat(result.messages()).last().isEqualTo(ChatMessage.assistant("Hello"));
    }

    @Test
    void reasoningIsStrippedFromToolCallingTurns() {
        when(providerClient.streamChat(any())).thenReturn(
                Flux.just(new StreamEvent.ContentDelta("<reasoning>Echo it</reasoning>"),
                        new StreamEvent.ToolCalls(List.of(new ToolCallResponse("call_1", "echo", "{\"text\":\"hi\"}"))),
                        StreamEvent.completed()),
                Flux.just(new StreamEvent.ContentDelta("Done"), StreamEvent.completed()));

        AgentRunResult result = loop(AgentProperties.defaults()).run(PROJECT, history(), null, null);

        ChatMessage assistant = result.messages().get(1);
        assertThat(assistant.content()).isNull();
        assertThat(assistant.toolCalls()).extracting(ToolCall::id).containsExactly("call_1");
    }

    @Test
    void withoutReasoningHandlesUnterminatedBlocks() {
        assertThat(AgentLoop.withoutReasoning("Answer")).isEqualTo("Answer");
        assertThat(AgentLoop.withoutReasoning("<reasoning>a</reasoning>One<reasoning>b</reasoning> two"))
                .isEqualTo("One two");
        assertThat(AgentLoop.withoutReasoning("Text <reasoning>cut off")).isEqualTo("Text");
    }

    @Test
    @SuppressWarnings("unchecked")
    void oldTurnsArePrunedFromTheRequestButKeptInHistory() {
        when(providerClient.streamChat(any())).thenReturn(
                Flux.just(new StreamEvent.ContentDelta("Sure"), StreamEvent.completed()));
        List<ChatMessage> history = List.of(
                ChatMessage.user("Build a landing page " + "x".repeat(400)),
                ChatMessage.assistant("Here it is " + "y".repeat(400)),
                ChatMessage.user("Now add a footer"));

        AgentRunResult result = loop(new AgentProperties(null, null, null, 1, null))
                .run(PROJECT, history, null, null);

        ArgumentCaptor<List<ChatMessage>> request = ArgumentCaptor.forClass(List.class);
        verify(providerClient).newRequest(request.capture(), any());
        assertThat(request.getValue()).extracting(ChatMessage::role).containsExactly("system", "user");
        assertThat(request.getValue().get(1)).isEqualTo(ChatMessage.user("Now add a footer"));
        assertThat(result.messages()).hasSize(4);
    }

    @Test
    void shutdownCancelsActiveRunsAndStopsTheExecutor() throws Exception {
        when(providerClient.streamChat(any())).thenReturn(
                Flux.concat(Flux.just(new StreamEvent.ContentDelta("thinking...")), Flux.never()));
        CountDownLatch streaming = new CountDownLatch(1);
        AgentListener listener = new AgentListener() {
            @Override
            public void onContent(String transcript, List<ContentBlock> blocks) {
                streaming.countDown();
            }
        };
        AgentLoop loop = loop(AgentProperties.defaults());
        loop.startAsync(PROJECT, history(), null, listener);
        assertThat(streaming.await(5, TimeUnit.SECONDS)).isTrue();

        loop.shutdown();

        assertThat(loop.isShutdown()).isTrue();
        verify(lockService, timeout(5000)).release(PROJECT, "owner-1");
    }

    @Test
    void endSessionDropsTodos() {
        todoStore.create(PROJECT, "Write docs", null);

        loop(AgentProperties.defaults()).endSession(PROJECT);

        assertThat(todoStore.list(PROJECT)).isEmpty();
    }

    @Test
    void markerSummarizesFirstLineOfOutput() {
        assertThat(AgentLoop.toolMarker("read_file", ToolResult.success("line one\nline two"), null))
                .isEqualTo("\n\n🔧 **read_file**\n✅ line one");
        assertThat(AgentLoop.toolMarker("create_folder", ToolResult.success(""), null))
                .isEqualTo("\n\n🔧 **create_folder**\n✅ Done");
        assertThat(AgentLoop.toolMarker("read_file", ToolResult.failure("File not found: x"), new DiffStats(1, 1)))
                .isEqualTo("\n\n🔧 **read_file**\n❌ File not found: x");
    }

    private AgentLoop loop(AgentProperties properties) {
        ToolExecutor executor = new ToolExecutor(registry, projects, memories, todoStore, new ObjectMapper());
        return new AgentLoop(providerClient, registry, executor, lockService, todoStore,
                new SystemPromptBuilder(memories), new ContentSegmenter(), properties);
    }

    private static List<ChatMessage> history() {
        return List.of(ChatMessage.user("Say hello"));
    }

    private static Tool tool(String name, JsonNode schema, BiFunction<ToolContext, ToolArguments, ToolResult> body) {
        return new Tool() {
            @Override public String name() { return name; }
            @Override public String description() { return "Test tool " + name; }
            @Override public JsonNode inputSchema() { return schema; }
            @Override public ToolCategory category() { return ToolCategory.AGENT_CONTROL; }
            @Override public ToolResult execute(ToolContext ctx, ToolArguments args) { return body.apply(ctx, args); }
        };
    }
}
