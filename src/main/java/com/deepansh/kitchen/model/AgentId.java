package com.deepansh.kitchen.model;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Closed set of specialised agents.
 *
 * Declaration order is the planner's tie-break priority:
 * INVENTORY, RECIPE, HEALTH, SHOPPING. Do not reorder.
 */
public enum AgentId {

    INVENTORY("inventory", "inventory_agent", "inventory_check"),
    RECIPE("recipe", "recipe_agent", "recipe_generation"),
    HEALTH("health", "health_agent", "health_advice", "nutrition"),
    SHOPPING("shopping", "shopping_agent", "shopping_comparison");

    private final List<String> wireNames;

    AgentId(String... wireNames) {
        this.wireNames = List.of(wireNames);
    }

    /** Canonical lower-case name used on the wire and in logs. */
    public String wireName() {
        return wireNames.get(0);
    }

    /**
     * Maps an untrusted identifier (case-insensitive) onto the closed set.
     * Returns empty for anything unknown; never throws.
     */
    public static Optional<AgentId> fromWireName(String raw) {
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }
        String normalized = raw.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(id -> id.wireNames.contains(normalized))
                .findFirst();
    }
}
