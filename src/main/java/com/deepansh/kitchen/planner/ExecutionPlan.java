package com.deepansh.kitchen.planner;

import com.deepansh.kitchen.model.AgentId;

import java.util.List;

/**
 * Planner output. {@code waves} group agents with no edge between them;
 * every agent's prerequisites sit in an earlier wave. {@code orderedAgents}
 * is the waves concatenated and is the order sections are shown in.
 */
public record ExecutionPlan(List<List<AgentId>> waves) {

    public ExecutionPlan {
        waves = waves.stream().map(List::copyOf).toList();
    }

    public static ExecutionPlan empty() {
        return new ExecutionPlan(List.of());
    }

    public List<AgentId> orderedAgents() {
        return waves.stream().flatMap(List::stream).toList();
    }

    public boolean isEmpty() {
        return waves.isEmpty();
    }

    public int position(AgentId agentId) {
        return orderedAgents().indexOf(agentId);
    }
}
