package com.deepansh.kitchen.core;

import com.deepansh.kitchen.model.AgentOutput;

/**
 * What one dispatch produced, with the attempts it took.
 */
public record DispatchOutcome(AgentOutput output, int attempts, long latencyMs) {
}
