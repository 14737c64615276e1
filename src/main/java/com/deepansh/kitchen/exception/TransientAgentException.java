package com.deepansh.kitchen.exception;

/**
 * Network, timeout or rate-limit failure inside an agent. Eligible for retry.
 */
public class TransientAgentException extends KitchenAssistantException {

    public TransientAgentException(String message) {
        super(message);
    }

    public TransientAgentException(String message, Throwable cause) {
        super(message, cause);
    }
}
