package com.deepansh.kitchen.core;

import com.deepansh.kitchen.agent.PriorOutputs;
import com.deepansh.kitchen.model.AgentId;
import com.deepansh.kitchen.model.AgentOutput;
import com.deepansh.kitchen.model.Intent;
import com.deepansh.kitchen.model.Query;
import com.deepansh.kitchen.model.WorkflowStatus;
import com.deepansh.kitchen.planner.ExecutionPlan;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Mutable record threaded through one request's orchestration.
 *
 * Outputs are append-only: an agent is recorded at most once and only if the
 * intent requires it, so {@code completedAgents == outputs.keySet()} and
 * {@code completedAgents ⊆ requiredAgents} hold after every call.
 * Status changes follow the loop's transition table and are logged in order.
 *
 * Owned by a single workflow; not shared between threads.
 */
public final class WorkflowState {

    private static final Map<WorkflowStatus, Set<WorkflowStatus>> ALLOWED = new EnumMap<>(WorkflowStatus.class);

    static {
        ALLOWED.put(WorkflowStatus.ROUTING,
                EnumSet.of(WorkflowStatus.DISPATCHING, WorkflowStatus.SYNTHESIZING, WorkflowStatus.FAILED));
        ALLOWED.put(WorkflowStatus.DISPATCHING, EnumSet.of(WorkflowStatus.ROUTING));
        ALLOWED.put(WorkflowStatus.SYNTHESIZING, EnumSet.of(WorkflowStatus.DONE, WorkflowStatus.FAILED));
        ALLOWED.put(WorkflowStatus.DONE, EnumSet.noneOf(WorkflowStatus.class));
        ALLOWED.put(WorkflowStatus.FAILED, EnumSet.noneOf(WorkflowStatus.class));
    }

    private final String requestId;
    private final Query query;
    private final Intent intent;
    private final ExecutionPlan plan;

    private final Map<AgentId, AgentOutput> outputs = new EnumMap<>(AgentId.class);
    private final List<Transition> history = new ArrayList<>();
    private WorkflowStatus status = WorkflowStatus.ROUTING;

    public WorkflowState(String requestId, Query query, Intent intent, ExecutionPlan plan) {
        Set<AgentId> planned = plan.orderedAgents().isEmpty()
                ? EnumSet.noneOf(AgentId.class)
                : EnumSet.copyOf(plan.orderedAgents());
        if (!planned.equals(intent.requiredAgentSet())) {
            throw new IllegalArgumentException("Plan " + plan.orderedAgents()
                    + " does not cover required agents " + intent.requiredAgents());
        }
        this.requestId = requestId;
        this.query = query;
        this.intent = intent;
        this.plan = plan;
    }

    /**
     * Records the output of one agent and marks it completed.
     *
     * @throws IllegalStateException if the agent is not required, is already
     *                               completed, or the output belongs to another agent
     */
    public void record(AgentId agentId, AgentOutput output) {
        if (!intent.requires(agentId)) {
            throw new IllegalStateException("Agent " + agentId + " is not required by this workflow");
        }
        if (outputs.containsKey(agentId)) {
            throw new IllegalStateException("Output for " + agentId + " already recorded");
        }
        if (output == null || output.agentId() != agentId) {
            throw new IllegalStateException("Output does not belong to " + agentId);
        }
        outputs.put(agentId, output);
    }

    public void transitionTo(WorkflowStatus next, List<AgentId> agents, String note) {
        if (!ALLOWED.get(status).contains(next)) {
            throw new IllegalStateException("Illegal transition " + status + " -> " + next);
        }
        history.add(new Transition(status, next, agents, note, Instant.now()));
        status = next;
    }

    public void transitionTo(WorkflowStatus next, String note) {
        transitionTo(next, List.of(), note);
    }

    /** Required agents not yet completed, in planner order. */
    public List<AgentId> pending() {
        return plan.orderedAgents().stream()
                .filter(id -> !outputs.containsKey(id))
                .toList();
    }

    /** Pending members of the earliest wave that still has any. */
    public List<AgentId> nextWave() {
        for (List<AgentId> wave : plan.waves()) {
            List<AgentId> open = wave.stream().filter(id -> !outputs.containsKey(id)).toList();
            if (!open.isEmpty()) {
                return open;
            }
        }
        return List.of();
    }

    public PriorOutputs priorOutputsView() {
        return PriorOutputs.snapshotOf(outputs);
    }

    public Set<AgentId> completedAgents() {
        return outputs.isEmpty()
                ? Collections.emptySet()
                : Collections.unmodifiableSet(EnumSet.copyOf(outputs.keySet()));
    }

    public Map<AgentId, AgentOutput> outputs() {
        return Collections.unmodifiableMap(new EnumMap<>(outputs));
    }

    public List<Transition> history() {
        return List.copyOf(history);
    }

    public WorkflowStatus status() {
        return status;
    }

    public String requestId() {
        return requestId;
    }

    public Query query() {
        return query;
    }

    public Intent intent() {
        return intent;
    }

    public ExecutionPlan plan() {
        return plan;
    }
}
