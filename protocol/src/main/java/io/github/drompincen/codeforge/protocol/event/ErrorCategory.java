package io.github.drompincen.codeforge.protocol.event;

public enum ErrorCategory {
    INVALID_CREDENTIALS(false),
    INSUFFICIENT_QUOTA(false),
    RATE_LIMITED(true),
    UNAVAILABLE(true),
    MODEL_NOT_FOUND(false),
    PROVIDER_ERROR(false),
    NETWORK(true);

    private final boolean retriable;

    ErrorCategory(boolean retriable) {
        this.retriable = retriable;
    }

    public boolean isRetriable() {
        return retriable;
    }
}
