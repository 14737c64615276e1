package com.deepansh.kitchen.model;

/**
 * Result of one agent dispatch: a typed success payload or a recorded error.
 */
public sealed interface AgentOutput
        permits RecipeResult, InventoryResult, ShoppingResult, HealthResult, AgentError {

    AgentId agentId();

    default boolean isSuccess() {
        return !(this instanceof AgentError);
    }
}
