package io.github.drompincen.codeforge.runtime.llm;

import io.github.drompincen.codeforge.protocol.event.ErrorCategory;

/**
 * A chat completion request failed. The message is already rewritten for the end user.
 */
public class ProviderException extends RuntimeException {

    private final ErrorCategory category;

    public ProviderException(String message, ErrorCategory category) {
        super(message);
        this.category = category;
    }

    public ProviderException(String message, ErrorCategory category, Throwable cause) {
        super(message, cause);
        this.category = category;
    }

    public ErrorCategory getCategory() {
        return category;
    }
}
