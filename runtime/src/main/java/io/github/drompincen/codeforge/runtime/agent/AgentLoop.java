package io.github.drompincen.codeforge.runtime.agent;

import io.github.drompincen.codeforge.protocol.api.ChatMessage;
import io.github.drompincen.codeforge.protocol.api.ChatRequest;
import io.github.drompincen.codeforge.protocol.api.FileChangeEvent;
import io.github.drompincen.codeforge.protocol.api.TodoItem;
import io.github.drompincen.codeforge.protocol.api.ToolCallResponse;
import io.github.drompincen.codeforge.protocol.content.DiffStats;
import io.github.drompincen.codeforge.protocol.event.StreamEvent;
import io.github.drompincen.codeforge.runtime.content.ContentSegmenter;
import io.github.drompincen.codeforge.runtime.content.IncrementalContentSegmenter;
import io.github.drompincen.codeforge.runtime.diff.LineDiff;
import io.github.drompincen.codeforge.runtime.llm.ProviderClient;
import io.github.drompincen.codeforge.runtime.llm.StreamEventDecoder;
import io.github.drompincen.codeforge.runtime.lock.ProjectLockService;
import io.github.drompincen.codeforge.runtime.todo.TodoStore;
import io.github.drompincen.codeforge.runtime.tools.ToolExecutor;
import io.github.drompincen.codeforge.runtime.tools.ToolInteractionCallback;
import io.github.drompincen.codeforge.runtime.tools.ToolRegistry;
import io.github.drompincen.codeforge.runtime.tools.ToolResult;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Sinks;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.*;
import java.util.regex.Pattern;

/**
 * Drives a conversation turn by turn: stream a completion, run the tool calls it ends with,
 * feed the results back and repeat until the model stops calling tools.
 * <p>
 * Tool calls run one at a time in the order the model issued them, and their results are
 * appended in that same order. Only one run per project is active at a time.
 */
@Component
public class AgentLoop {

    private static final Logger log = LoggerFactory.getLogger(AgentLoop.class);
    private static final int MARKER_OUTPUT_LIMIT = 200;
    private static final Pattern REASONING = Pattern.compile(
            Pattern.quote(StreamEventDecoder.REASONING_OPEN) + ".*?(?:"
                    + Pattern.quote(StreamEventDecoder.REASONING_CLOSE) + "|$)", Pattern.DOTALL);

    private final ProviderClient providerClient;
    private final ToolRegistry toolRegistry;
    private final ToolExecutor toolExecutor;
    private final ProjectLockService lockService;
    private final TodoStore todoStore;
    private final SystemPromptBuilder promptBuilder;
    private final ContentSegmenter segmenter;
    private final AgentProperties properties;
    private final ContextWindow contextWindow;
    private final ExecutorService executor = Executors.newCachedThreadPool(r -> {
        Thread t = new Thread(r, "agent-loop");
        t.setDaemon(true);
        return t;
    });
    private final ConcurrentHashMap<String, Sinks.One<Boolean>> cancellations = new ConcurrentHashMap<>();

    public AgentLoop(ProviderClient providerClient,
                     ToolRegistry toolRegistry,
                     ToolExecutor toolExecutor,
                     ProjectLockService lockService,
                     TodoStore todoStore,
                     SystemPromptBuilder promptBuilder,
                     ContentSegmenter segmenter,
                     AgentProperties properties) {
        this.providerClient = providerClient;
        this.toolRegistry = toolRegistry;
        this.toolExecutor = toolExecutor;
        this.lockService = lockService;
        this.todoStore = todoStore;
        this.promptBuilder = promptBuilder;
        this.segmenter = segmenter;
        this.properties = properties;
        this.contextWindow = ContextWindow.from(properties);
    }

    @PreDestroy
    void shutdown() {
        log.info("Shutting down agent runs");
        cancellations.values().forEach(cancel -> cancel.tryEmitValue(Boolean.TRUE));
        executor.shutdownNow();
    }

    boolean isShutdown() {
        return executor.isShutdown();
    }

    public Future<AgentRunResult> startAsync(String projectId, List<ChatMessage> history,
                                             ToolInteractionCallback callback, AgentListener listener) {
        return executor.submit(() -> run(projectId, history, callback, listener));
    }

    /** Cancels the active run of a project, closing its stream. */
    public void stop(String projectId) {
        Sinks.One<Boolean> cancel = cancellations.get(projectId);
        if (cancel != null) {
            log.info("Cancelling agent run for project {}", projectId);
            cancel.tryEmitValue(Boolean.TRUE);
        }
    }

    public boolean isRunning(String projectId) {
        return cancellations.containsKey(projectId);
    }

    /** Ends the conversation session of a project, dropping its todo list. */
    public void endSession(String projectId) {
        stop(projectId);
        todoStore.clear(projectId);
    }

    public AgentRunResult run(String projectId, List<ChatMessage> history,
                              ToolInteractionCallback callback, AgentListener listener) {
        Optional<String> lockOwner = lockService.tryAcquire(projectId);
        if (lockOwner.isEmpty()) {
            log.warn("Agent run already active for project {}", projectId);
            return AgentRunResult.busy();
        }
        String owner = lockOwner.get();
        Sinks.One<Boolean> cancel = Sinks.one();
        cancellations.put(projectId, cancel);
        AgentListener events = listener != null ? listener : AgentListener.NONE;
        Run run = new Run(projectId, history, callback, events, cancel);
        log.info("Agent run started for project {}", projectId);
        try {
            AgentRunResult result = run.execute(owner);
            log.info("Agent run for project {} ended with {} after {} iterations",
                    projectId, result.status(), result.iterations());
            events.onComplete(result);
            return result;
        } finally {
            cancellations.remove(projectId, cancel);
            lockService.release(projectId, owner);
        }
    }

    static String toolMarker(String name, ToolResult result, DiffStats stats) {
        StringBuilder sb = new StringBuilder("\n\n").append(ContentSegmenter.TOOL_MARKER)
                .append(" **").append(name).append("**\n");
        if (result.success()) {
            sb.append(ContentSegmenter.SUCCESS_GLYPH).append(' ').append(summarize(result.output()));
            if (stats != null) {
                sb.append(' ').append(stats.format());
            }
        } else {
            sb.append(ContentSegmenter.ERROR_GLYPH).append(' ').append(summarize(result.error()));
        }
        return sb.toString();
    }

    /** Removes reasoning the model streamed, which is shown to the user but not sent back. */
    static String withoutReasoning(String content) {
        if (content == null || !content.contains(StreamEventDecoder.REASONING_OPEN)) {
            return content;
        }
        return REASONING.matcher(content).replaceAll("").strip();
    }

    private static String summarize(String text) {
        if (text == null || text.isBlank()) {
            return "Done";
        }
        String line = text.strip();
        int newline = line.indexOf('\n');
        if (newline >= 0) {
            line = line.substring(0, newline).strip();
        }
        return line.length() > MARKER_OUTPUT_LIMIT ? line.substring(0, MARKER_OUTPUT_LIMIT) + "..." : line;
    }

    /** State of one run; confined to the thread executing {@link #run}. */
    private final class Run {
        private final String projectId;
        private final List<ChatMessage> messages;
        private final TrackingCallback callback;
        private final AgentListener listener;
        private final Sinks.One<Boolean> cancel;
        private final StringBuilder transcript = new StringBuilder();
        private final IncrementalContentSegmenter live = new IncrementalContentSegmenter(segmenter);
        private volatile boolean cancelled;

        private Run(String projectId, List<ChatMessage> history, ToolInteractionCallback delegate,
                    AgentListener listener, Sinks.One<Boolean> cancel) {
            this.projectId = projectId;
            this.messages = new ArrayList<>(history != null ? history : List.of());
            this.callback = new TrackingCallback(delegate != null ? delegate : ToolInteractionCallback.NONE);
            this.listener = listener;
            this.cancel = cancel;
        }

        AgentRunResult execute(String owner) {
            String systemPrompt = promptBuilder.build(projectId, toolRegistry.all());
            int iteration = 0;
            while (iteration < properties.maxIterations()) {
                iteration++;
                lockService.renew(projectId, owner);
                List<ChatMessage> request = contextWindow.fit(systemPrompt, messages);
                Turn turn = streamWithRetry(providerClient.newRequest(request, toolRegistry.definitions()));

                if (turn.cancelled || cancelled) {
                    return result(AgentRunResult.Status.CANCELLED, null, iteration);
                }
                if (turn.error != null) {
                    listener.onError(turn.error);
                    return result(AgentRunResult.Status.FAILED, turn.error, iteration);
                }
                if (turn.toolCalls.isEmpty()) {
                    messages.add(ChatMessage.assistant(withoutReasoning(turn.content.toString())));
                    return result(AgentRunResult.Status.COMPLETED, null, iteration);
                }

                messages.add(ChatMessage.assistant(withoutReasoning(turn.content.toString()), turn.toolCalls));
                for (ToolCallResponse call : turn.toolCalls) {
                    executeTool(call);
                }
                if (callback.finishedSummary != null) {
                    return result(AgentRunResult.Status.FINISHED, null, iteration);
                }
                if (cancelled) {
                    return result(AgentRunResult.Status.CANCELLED, null, iteration);
                }
            }
            log.warn("Agent run for project {} hit the iteration limit of {}", projectId, properties.maxIterations());
            return result(AgentRunResult.Status.MAX_ITERATIONS, null, iteration);
        }

        private void executeTool(ToolCallResponse call) {
            listener.onToolStarted(call);
            callback.lastChange = null;
            ToolResult result = toolExecutor.execute(projectId, call, callback);
            messages.add(ChatMessage.toolResult(call.id(), call.name(), result.toModelContent()));
            DiffStats stats = result.success() && callback.lastChange != null ? diffStats(callback.lastChange) : null;
            transcript.append(toolMarker(call.name(), result, stats));
            listener.onToolFinished(call, result);
            publish(true);
        }

        private Turn streamWithRetry(ChatRequest request) {
            int attempt = 0;
            while (true) {
                Turn turn = stream(request);
                boolean retriable = turn.error != null && turn.error.category().isRetriable()
                        && turn.content.length() == 0 && turn.toolCalls.isEmpty();
                if (!retriable || attempt >= properties.maxRetries()) {
                    return turn;
                }
                attempt++;
                long backoff = properties.retryBackoff().toMillis() * attempt;
                log.warn("Retrying completion for project {} in {} ms after: {}", projectId, backoff,
                        turn.error.message());
                try {
                    Thread.sleep(backoff);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    turn.cancelled = true;
                    return turn;
                }
                if (cancelled) {
                    turn.cancelled = true;
                    return turn;
                }
            }
        }

        private Turn stream(ChatRequest request) {
            Turn turn = new Turn();
            boolean separate = transcript.length() > 0;
            providerClient.streamChat(request)
                    .takeUntilOther(cancel.asMono().doOnNext(v -> cancelled = true))
                    .doOnNext(event -> turn.accept(event, this, separate))
                    .blockLast();
            turn.cancelled = !turn.terminal;
            return turn;
        }

        void appendContent(String text, boolean separate, boolean first) {
            if (first && separate) {
                transcript.append("\n\n");
            }
            transcript.append(text);
            publish(true);
        }

        private void publish(boolean streaming) {
            String text = transcript.toString();
            listener.onContent(text, live.update(text, streaming));
        }

        private AgentRunResult result(AgentRunResult.Status status, StreamEvent.Error error, int iterations) {
            publish(false);
            return new AgentRunResult(status, transcript.toString(), messages, callback.finishedSummary,
                    error, iterations);
        }
    }

    private static DiffStats diffStats(FileChangeEvent change) {
        return LineDiff.stats(change.oldContent(), change.newContent());
    }

    /** Collects the events of one model turn. */
    private static final class Turn {
        private final StringBuilder content = new StringBuilder();
        private final List<ToolCallResponse> toolCalls = new ArrayList<>();
        private StreamEvent.Error error;
        private boolean terminal;
        private boolean cancelled;

        void accept(StreamEvent event, Run run, boolean separate) {
            if (event instanceof StreamEvent.ContentDelta delta) {
                run.appendContent(delta.text(), separate, content.length() == 0);
                content.append(delta.text());
            } else if (event instanceof StreamEvent.ToolCalls calls) {
                toolCalls.addAll(calls.calls());
            } else if (event instanceof StreamEvent.Error failure) {
                error = failure;
                terminal = true;
            } else if (event instanceof StreamEvent.Completed) {
                terminal = true;
            } else if (event instanceof StreamEvent.FinishReason reason) {
                log.debug("Finish reason: {}", reason.reason());
            }
        }
    }

    /** Passes interactions through while remembering what the current tool did. */
    private static final class TrackingCallback implements ToolInteractionCallback {
        private final ToolInteractionCallback delegate;
        private volatile FileChangeEvent lastChange;
        private volatile String finishedSummary;

        private TrackingCallback(ToolInteractionCallback delegate) {
            this.delegate = delegate;
        }

        @Override
        public Optional<String> askUser(String question, List<String> options) {
            return delegate.askUser(question, options);
        }

        @Override
        public boolean canAskUser() {
            return delegate.canAskUser();
        }

        @Override
        public void onFileChanged(FileChangeEvent change) {
            lastChange = change;
            delegate.onFileChanged(change);
        }

        @Override
        public void onTodoCreated(TodoItem todo) {
            delegate.onTodoCreated(todo);
        }

        @Override
        public void onTodoUpdated(TodoItem todo) {
            delegate.onTodoUpdated(todo);
        }

        @Override
        public void onTaskFinished(String summary) {
            finishedSummary = summary;
            delegate.onTaskFinished(summary);
        }
    }
}
