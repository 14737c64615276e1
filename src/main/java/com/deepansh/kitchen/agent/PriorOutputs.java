package com.deepansh.kitchen.agent;

import com.deepansh.kitchen.model.AgentId;
import com.deepansh.kitchen.model.AgentOutput;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Read-only snapshot of outputs recorded before a dispatch.
 * Later writes to the workflow state are not visible through it.
 */
public final class PriorOutputs {

    private static final PriorOutputs EMPTY = new PriorOutputs(Map.of());

    private final Map<AgentId, AgentOutput> outputs;

    private PriorOutputs(Map<AgentId, AgentOutput> outputs) {
        this.outputs = outputs.isEmpty()
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new EnumMap<>(outputs));
    }

    public static PriorOutputs snapshotOf(Map<AgentId, AgentOutput> outputs) {
        return outputs.isEmpty() ? EMPTY : new PriorOutputs(outputs);
    }

    public static PriorOutputs empty() {
        return EMPTY;
    }

    /**
     * The successful output of {@code agentId}, if it completed and succeeded.
     * Recorded errors are not returned here.
     */
    public <T extends AgentOutput> Optional<T> success(AgentId agentId, Class<T> type) {
        AgentOutput output = outputs.get(agentId);
        if (type.isInstance(output)) {
            return Optional.of(type.cast(output));
        }
        return Optional.empty();
    }

    public boolean hasCompleted(AgentId agentId) {
        return outputs.containsKey(agentId);
    }

    public Set<AgentId> completedAgents() {
        return outputs.keySet();
    }
}
