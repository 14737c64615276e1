package com.deepansh.kitchen.exception;

/**
 * Failure talking to the LLM provider.
 *
 * {@code retryable} is true for 429, 5xx and network errors; false for
 * authentication, bad requests and unparseable output.
 */
public class LlmException extends KitchenAssistantException {

    private final boolean retryable;

    public LlmException(String message, boolean retryable) {
        super(message);
        this.retryable = retryable;
    }

    public LlmException(String message, boolean retryable, Throwable cause) {
        super(message, cause);
        this.retryable = retryable;
    }

    public boolean isRetryable() {
        return retryable;
    }
}
