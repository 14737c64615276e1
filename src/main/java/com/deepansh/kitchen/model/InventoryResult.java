package com.deepansh.kitchen.model;

import java.util.List;

/**
 * Pantry contents plus, when a dish was named, what the pantry lacks for it.
 */
public record InventoryResult(List<PantryItem> available, List<Ingredient> missing) implements AgentOutput {

    public InventoryResult {
        available = List.copyOf(available);
        missing = List.copyOf(missing);
    }

    @Override
    public AgentId agentId() {
        return AgentId.INVENTORY;
    }
}
