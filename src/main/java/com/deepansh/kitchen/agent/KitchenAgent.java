package com.deepansh.kitchen.agent;

import com.deepansh.kitchen.exception.PermanentAgentException;
import com.deepansh.kitchen.exception.TransientAgentException;
import com.deepansh.kitchen.model.AgentId;
import com.deepansh.kitchen.model.AgentOutput;

/**
 * Contract every specialised responder implements.
 *
 * An agent may read the outputs of agents that already completed, through
 * {@link AgentInvocation#priorOutputs()}, but never modify them.
 *
 * Failures are reported by throwing {@link TransientAgentException} (retried
 * by the dispatcher) or {@link PermanentAgentException} (recorded at once).
 * The dispatcher may call {@link #execute} several times for the same
 * invocation, so side effects must be keyed on {@link AgentInvocation#invocationId()}.
 */
public interface KitchenAgent {

    /** Which slot of the closed agent set this responder fills */
    AgentId id();

    /**
     * Run the agent and return its typed success payload.
     * Must never return an {@code AgentError}; throw instead.
     */
    AgentOutput execute(AgentInvocation invocation);
}
