package io.github.drompincen.codeforge.runtime.llm;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.drompincen.codeforge.protocol.api.ChatCompletionResponse;
import io.github.drompincen.codeforge.protocol.api.ChatMessage;
import io.github.drompincen.codeforge.protocol.api.ChatRequest;
import io.github.drompincen.codeforge.protocol.api.ToolDefinition;
import io.github.drompincen.codeforge.protocol.event.ErrorCategory;
import io.github.drompincen.codeforge.protocol.event.StreamEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.FluxSink;
import reactor.core.scheduler.Schedulers;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.util.Iterator;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Client for OpenAI-compatible chat completions. {@link #streamChat} opens one SSE connection per
 * subscription and decodes it into {@link StreamEvent}s; disposing the subscription closes the
 * connection. Failures surface as a terminal {@link StreamEvent.Error}, never as an error signal.
 */
@Component
public class ProviderClient {

    private static final Logger log = LoggerFactory.getLogger(ProviderClient.class);

    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final ProviderProperties properties;
    private final ProviderErrorMapper errorMapper;

    public ProviderClient(HttpClient httpClient, ObjectMapper objectMapper, ProviderProperties properties) {
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
        this.properties = properties;
        this.errorMapper = new ProviderErrorMapper(objectMapper);
    }

    /** A streaming request using the configured model and sampling settings. */
    public ChatRequest newRequest(List<ChatMessage> messages, List<ToolDefinition> tools) {
        return ChatRequest.of(properties.model(), messages, properties.temperature(), properties.maxTokens(), tools);
    }

    public Flux<StreamEvent> streamChat(ChatRequest request) {
        return Flux.<StreamEvent>create(sink -> stream(request.withStream(true), sink))
                .subscribeOn(Schedulers.boundedElastic());
    }

    public ChatCompletionResponse chat(ChatRequest request) {
        HttpRequest httpRequest = buildRequest(request.withStream(false), "application/json");
        HttpResponse<String> response;
        try {
            response = httpClient.send(httpRequest, HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw errorMapper.toException(errorMapper.fromThrowable(e), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ProviderException("Request interrupted", ErrorCategory.NETWORK, e);
        }
        if (response.statusCode() / 100 != 2) {
            log.warn("Chat completion failed with HTTP {}", response.statusCode());
            throw errorMapper.toException(errorMapper.fromStatus(response.statusCode(), response.body()), null);
        }
        try {
            return objectMapper.readValue(response.body(), ChatCompletionResponse.class);
        } catch (JsonProcessingException e) {
            throw new ProviderException("Unexpected response from provider", ErrorCategory.PROVIDER_ERROR, e);
        }
    }

    private void stream(ChatRequest request, FluxSink<StreamEvent> sink) {
        AtomicReference<Stream<String>> body = new AtomicReference<>();
        sink.onDispose(() -> {
            Stream<String> lines = body.getAndSet(null);
            if (lines != null) {
                lines.close();
            }
        });
        try {
            HttpResponse<Stream<String>> response = httpClient.send(
                    buildRequest(request, "text/event-stream"), HttpResponse.BodyHandlers.ofLines());
            if (response.statusCode() / 100 != 2) {
                String errorBody;
                try (Stream<String> lines = response.body()) {
                    errorBody = lines.collect(Collectors.joining("\n"));
                }
                log.warn("Streaming request failed with HTTP {}", response.statusCode());
                sink.next(errorMapper.fromStatus(response.statusCode(), errorBody));
                sink.complete();
                return;
            }
            body.set(response.body());
            if (sink.isCancelled()) {
                response.body().close();
                return;
            }
            sink.next(StreamEvent.started());

            StreamEventDecoder decoder = new StreamEventDecoder(objectMapper, errorMapper);
            Iterator<String> lines = response.body().iterator();
            while (!sink.isCancelled() && !decoder.isTerminated() && lines.hasNext()) {
                for (StreamEvent event : decoder.decode(lines.next())) {
                    sink.next(event);
                }
            }
            if (!decoder.isTerminated() && !sink.isCancelled()) {
                log.warn("Stream for model {} ended without [DONE]", request.model());
            }
            sink.complete();
        } catch (IOException | RuntimeException e) {
            if (sink.isCancelled()) {
                log.debug("Stream closed after cancellation: {}", e.getMessage());
                return;
            }
            log.warn("Streaming request failed: {}", e.toString());
            sink.next(errorMapper.fromThrowable(e instanceof UncheckedIOException u ? u.getCause() : e));
            sink.complete();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            sink.complete();
        } finally {
            Stream<String> lines = body.getAndSet(null);
            if (lines != null) {
                lines.close();
            }
        }
    }

    private HttpRequest buildRequest(ChatRequest request, String accept) {
        String json;
        try {
            json = objectMapper.writeValueAsString(request);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize chat request", e);
        }
        HttpRequest.Builder builder = HttpRequest.newBuilder(URI.create(properties.completionsUrl()))
                .timeout(properties.readTimeout())
                .header("Content-Type", "application/json")
                .header("Accept", accept)
                .header("User-Agent", "CodeForge/1.0")
                .header("HTTP-Referer", properties.referer())
                .header("X-Title", properties.title())
                .POST(HttpRequest.BodyPublishers.ofString(json));
        if (properties.apiKey() != null && !properties.apiKey().isBlank()) {
            builder.header("Authorization", "Bearer " + properties.apiKey());
        }
        log.debug("POST {} model={} messages={} tools={}", properties.completionsUrl(), request.model(),
                request.messages().size(), request.tools() == null ? 0 : request.tools().size());
        return builder.build();
    }
}
