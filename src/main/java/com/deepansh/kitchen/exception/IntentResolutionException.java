package com.deepansh.kitchen.exception;

/**
 * No usable intent could be formed from the query.
 * Aborts the whole request; the caller receives a clarification prompt.
 */
public class IntentResolutionException extends KitchenAssistantException {

    public IntentResolutionException(String message) {
        super(message);
    }

    public IntentResolutionException(String message, Throwable cause) {
        super(message, cause);
    }
}
