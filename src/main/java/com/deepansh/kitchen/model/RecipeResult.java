package com.deepansh.kitchen.model;

import java.util.List;

public record RecipeResult(String name,
                           List<Ingredient> ingredients,
                           List<Ingredient> missingIngredients,
                           List<String> instructions,
                           String cookingTime,
                           int servings) implements AgentOutput {

    public RecipeResult {
        ingredients = List.copyOf(ingredients);
        missingIngredients = List.copyOf(missingIngredients);
        instructions = List.copyOf(instructions);
    }

    @Override
    public AgentId agentId() {
        return AgentId.RECIPE;
    }
}
