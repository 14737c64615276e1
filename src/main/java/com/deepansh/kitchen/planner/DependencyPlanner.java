package com.deepansh.kitchen.planner;

import com.deepansh.kitchen.exception.PlannerConfigurationException;
import com.deepansh.kitchen.model.AgentId;
import com.deepansh.kitchen.model.DependencySignal;
import com.deepansh.kitchen.model.Intent;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Orders required agents by a fixed partial-order table.
 *
 * Level-by-level topological sort: each wave holds the agents whose active
 * prerequisites are all in earlier waves, sorted by {@link AgentId}
 * declaration order. Output depends only on the required set and signals.
 *
 * The table is checked once at construction with every agent required and
 * every signal on, so a cyclic table fails start-up rather than a request.
 */
@Slf4j
public class DependencyPlanner {

    private final List<DependencyRule> rules;

    public DependencyPlanner(List<DependencyRule> rules) {
        this.rules = List.copyOf(rules);
        ExecutionPlan worstCase = planWaves(EnumSet.allOf(AgentId.class), EnumSet.allOf(DependencySignal.class));
        log.info("Dependency table validated: {} rules, full order {}", rules.size(), worstCase.orderedAgents());
    }

    public static DependencyPlanner withDefaultRules() {
        return new DependencyPlanner(DependencyRule.defaults());
    }

    public ExecutionPlan plan(Intent intent) {
        return planWaves(intent.requiredAgentSet(), intent.signals());
    }

    /** Ordered visiting sequence for the required agents. */
    public List<AgentId> plan(Set<AgentId> requiredAgents, Set<DependencySignal> signals) {
        return planWaves(requiredAgents, signals).orderedAgents();
    }

    /** Ordering with no signals active: pure declaration priority. */
    public List<AgentId> plan(Set<AgentId> requiredAgents) {
        return plan(requiredAgents, EnumSet.noneOf(DependencySignal.class));
    }

    public ExecutionPlan planWaves(Set<AgentId> requiredAgents, Set<DependencySignal> signals) {
        if (requiredAgents.isEmpty()) {
            return ExecutionPlan.empty();
        }

        Map<AgentId, Set<AgentId>> prerequisites = activeEdges(requiredAgents, signals);
        Set<AgentId> remaining = EnumSet.copyOf(requiredAgents);
        Set<AgentId> placed = EnumSet.noneOf(AgentId.class);
        List<List<AgentId>> waves = new ArrayList<>();

        while (!remaining.isEmpty()) {
            // EnumSet iterates in declaration order, which is the tie-break
            List<AgentId> wave = new ArrayList<>();
            for (AgentId candidate : remaining) {
                if (placed.containsAll(prerequisites.get(candidate))) {
                    wave.add(candidate);
                }
            }
            if (wave.isEmpty()) {
                log.error("Cyclic dependency table: cannot place {} (edges {})", remaining, prerequisites);
                throw new PlannerConfigurationException(
                        "Cyclic dependency among agents " + remaining + " in the planner table");
            }
            wave.forEach(remaining::remove);
            placed.addAll(wave);
            waves.add(wave);
        }

        ExecutionPlan plan = new ExecutionPlan(waves);
        log.debug("Planned {} with signals {} -> waves {}", requiredAgents, signals, waves);
        return plan;
    }

    private Map<AgentId, Set<AgentId>> activeEdges(Set<AgentId> required, Set<DependencySignal> signals) {
        Map<AgentId, Set<AgentId>> edges = new EnumMap<>(AgentId.class);
        required.forEach(id -> edges.put(id, EnumSet.noneOf(AgentId.class)));

        for (DependencyRule rule : rules) {
            if (!required.contains(rule.dependent()) || !signals.contains(rule.signal())) {
                continue;
            }
            for (AgentId prerequisite : rule.prerequisites()) {
                if (required.contains(prerequisite)) {
                    edges.get(rule.dependent()).add(prerequisite);
                }
            }
        }
        return edges;
    }
}
