package com.deepansh.kitchen.exception;

/**
 * Base exception for all kitchen assistant errors.
 * Unchecked so it can cross lambda and executor boundaries without wrapping.
 */
public class KitchenAssistantException extends RuntimeException {

    public KitchenAssistantException(String message) {
        super(message);
    }

    public KitchenAssistantException(String message, Throwable cause) {
        super(message, cause);
    }
}
