package com.deepansh.kitchen.model;

/**
 * States of the orchestration loop. DONE and FAILED are terminal.
 */
public enum WorkflowStatus {
    ROUTING,
    DISPATCHING,
    SYNTHESIZING,
    DONE,
    FAILED;

    public boolean isTerminal() {
        return this == DONE || this == FAILED;
    }
}
