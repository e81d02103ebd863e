package io.github.drompincen.codeforge.runtime.llm;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.drompincen.codeforge.protocol.api.ApiErrorResponse;
import io.github.drompincen.codeforge.protocol.event.ErrorCategory;
import io.github.drompincen.codeforge.protocol.event.StreamEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.http.HttpTimeoutException;
import java.util.Locale;

/**
 * Translates HTTP statuses, provider error bodies and transport failures into messages an end user
 * can act on.
 */
public class ProviderErrorMapper {

    private static final Logger log = LoggerFactory.getLogger(ProviderErrorMapper.class);

    static final String INVALID_KEY = "Invalid API key. Please check your API key in Settings.";
    static final String NO_CREDITS = "Insufficient credits. Please add credits to your account.";
    static final String RATE_LIMITED = "Rate limit exceeded. Please try again later.";
    static final String UNAVAILABLE = "Service temporarily unavailable. Please try again later.";
    static final String MODEL_NOT_FOUND = "Model not found. Please select a different model.";
    static final String TIMED_OUT = "Request timed out. Please try again.";

    private final ObjectMapper objectMapper;

    public ProviderErrorMapper(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public StreamEvent.Error fromStatus(int status, String body) {
        switch (status) {
            case 401:
                return new StreamEvent.Error(INVALID_KEY, ErrorCategory.INVALID_CREDENTIALS);
            case 402:
                return new StreamEvent.Error(NO_CREDITS, ErrorCategory.INSUFFICIENT_QUOTA);
            case 429:
                return new StreamEvent.Error(RATE_LIMITED, ErrorCategory.RATE_LIMITED);
            case 503:
                return new StreamEvent.Error(UNAVAILABLE, ErrorCategory.UNAVAILABLE);
            default:
                String message = providerMessage(body);
                if (message == null) {
                    return new StreamEvent.Error("Request failed with status " + status,
                            status >= 500 ? ErrorCategory.UNAVAILABLE : ErrorCategory.PROVIDER_ERROR);
                }
                return fromProviderMessage(message);
        }
    }

    public StreamEvent.Error fromProviderMessage(String message) {
        String lower = message.toLowerCase(Locale.ROOT);
        if (lower.contains("does not exist") || lower.contains("not found")) {
            return new StreamEvent.Error(MODEL_NOT_FOUND, ErrorCategory.MODEL_NOT_FOUND);
        }
        if (lower.contains("api key")) {
            return new StreamEvent.Error(INVALID_KEY, ErrorCategory.INVALID_CREDENTIALS);
        }
        return new StreamEvent.Error(message, ErrorCategory.PROVIDER_ERROR);
    }

    public StreamEvent.Error fromThrowable(Throwable t) {
        if (t instanceof HttpTimeoutException) {
            return new StreamEvent.Error(TIMED_OUT, ErrorCategory.NETWORK);
        }
        String message = t != null && t.getMessage() != null && !t.getMessage().isBlank()
                ? t.getMessage()
                : "Network error";
        return new StreamEvent.Error(message, ErrorCategory.NETWORK);
    }

    public ProviderException toException(StreamEvent.Error error, Throwable cause) {
        return new ProviderException(error.message(), error.category(), cause);
    }

    private String providerMessage(String body) {
        if (body == null || body.isBlank()) {
            return null;
        }
        try {
            ApiErrorResponse response = objectMapper.readValue(body, ApiErrorResponse.class);
            if (response.error() == null || response.error().message() == null
                    || response.error().message().isBlank()) {
                return null;
            }
            return response.error().message();
        } catch (JsonProcessingException e) {
            log.debug("Error body is not a provider error object: {}", e.getOriginalMessage());
            return null;
        }
    }
}
