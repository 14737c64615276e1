package com.deepansh.kitchen.planner;

import com.deepansh.kitchen.model.AgentId;
import com.deepansh.kitchen.model.DependencySignal;

import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * "{@code dependent} runs after {@code prerequisites}, when {@code signal} is present".
 * Only prerequisites that are themselves required produce an edge.
 */
public record DependencyRule(AgentId dependent, Set<AgentId> prerequisites, DependencySignal signal) {

    public DependencyRule {
        prerequisites = Set.copyOf(prerequisites);
        if (prerequisites.contains(dependent)) {
            throw new IllegalArgumentException(dependent + " cannot depend on itself");
        }
    }

    /** The data dependencies the kitchen agents actually have. */
    public static List<DependencyRule> defaults() {
        return List.of(
                new DependencyRule(AgentId.SHOPPING,
                        EnumSet.of(AgentId.RECIPE, AgentId.INVENTORY),
                        DependencySignal.MISSING_INGREDIENTS),
                new DependencyRule(AgentId.HEALTH,
                        EnumSet.of(AgentId.RECIPE),
                        DependencySignal.ANALYZE_GENERATED_RECIPE)
        );
    }
}
