package com.deepansh.kitchen.agent;

import com.deepansh.kitchen.model.AgentId;
import com.deepansh.kitchen.model.DependencySignal;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Everything an agent sees for one dispatch: the query text, extracted
 * entities, the intent's dependency signals, and a read-only view of outputs
 * completed so far.
 *
 * {@code invocationId} is stable across retries of the same dispatch.
 */
public record AgentInvocation(String invocationId,
                              String sessionId,
                              String queryText,
                              Map<String, String> entities,
                              Set<DependencySignal> signals,
                              PriorOutputs priorOutputs) {

    public AgentInvocation {
        entities = Map.copyOf(entities);
        signals = signals.isEmpty()
                ? Collections.unmodifiableSet(EnumSet.noneOf(DependencySignal.class))
                : Collections.unmodifiableSet(EnumSet.copyOf(signals));
    }

    public AgentInvocation(String invocationId, String sessionId, String queryText,
                           Map<String, String> entities, PriorOutputs priorOutputs) {
        this(invocationId, sessionId, queryText, entities, Set.of(), priorOutputs);
    }

    public static String invocationIdFor(String requestId, AgentId agentId) {
        return requestId + ":" + agentId.wireName();
    }

    public Optional<String> entity(String key) {
        String value = entities.get(key);
        return value == null || value.isBlank() ? Optional.empty() : Optional.of(value.trim());
    }

    public boolean hasSignal(DependencySignal signal) {
        return signals.contains(signal);
    }
}
