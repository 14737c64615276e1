package com.deepansh.kitchen.model;

/**
 * Recorded failure of one agent. Takes the agent's slot in the outputs so
 * the synthesizer can label its section as degraded.
 */
public record AgentError(AgentId agentId, String reason, Kind kind, int attempts) implements AgentOutput {

    public enum Kind {
        /** Transient failures persisted through every retry. */
        RETRIES_EXHAUSTED,
        /** Rejected outright; no retry attempted. */
        PERMANENT,
        /** The workflow deadline expired while retrying. */
        DEADLINE_EXCEEDED
    }
}
