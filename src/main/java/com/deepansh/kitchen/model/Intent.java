package com.deepansh.kitchen.model;

import java.util.Collections;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Structured interpretation of a query: which agents are needed, the entities
 * they work on, and the dependency signals the planner should honour.
 *
 * A clarification-only intent has no required agents and carries the
 * question to put back to the user.
 */
public record Intent(List<AgentId> requiredAgents,
                     Map<String, String> entities,
                     double confidence,
                     Set<DependencySignal> signals,
                     String clarification) {

    public Intent {
        requiredAgents = List.copyOf(new LinkedHashSet<>(requiredAgents));
        entities = Collections.unmodifiableMap(new LinkedHashMap<>(entities));
        confidence = Math.max(0.0, Math.min(1.0, confidence));
        signals = signals.isEmpty()
                ? Collections.unmodifiableSet(EnumSet.noneOf(DependencySignal.class))
                : Collections.unmodifiableSet(EnumSet.copyOf(signals));
    }

    public static Intent clarificationOnly(String question, Map<String, String> entities) {
        return new Intent(List.of(), entities, 0.0, Set.of(), question);
    }

    public boolean isClarificationOnly() {
        return requiredAgents.isEmpty();
    }

    public boolean requires(AgentId agentId) {
        return requiredAgents.contains(agentId);
    }

    public boolean hasSignal(DependencySignal signal) {
        return signals.contains(signal);
    }

    public Set<AgentId> requiredAgentSet() {
        return requiredAgents.isEmpty() ? EnumSet.noneOf(AgentId.class) : EnumSet.copyOf(requiredAgents);
    }
}
