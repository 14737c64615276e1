package com.deepansh.kitchen.exception;

/**
 * Invalid or unsupported request to an agent. Recorded immediately, never retried.
 */
public class PermanentAgentException extends KitchenAssistantException {

    public PermanentAgentException(String message) {
        super(message);
    }

    public PermanentAgentException(String message, Throwable cause) {
        super(message, cause);
    }
}
