package com.deepansh.kitchen.core;

import com.deepansh.kitchen.model.AgentId;
import com.deepansh.kitchen.model.WorkflowStatus;

import java.time.Instant;
import java.util.List;

/**
 * One entry of the workflow's transition log.
 */
public record Transition(WorkflowStatus from, WorkflowStatus to, List<AgentId> agents, String note, Instant at) {

    public Transition {
        agents = agents != null ? List.copyOf(agents) : List.of();
    }
}
