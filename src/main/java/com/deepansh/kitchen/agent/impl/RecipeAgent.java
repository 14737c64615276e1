package com.deepansh.kitchen.agent.impl;

import com.deepansh.kitchen.agent.AgentInvocation;
import com.deepansh.kitchen.agent.KitchenAgent;
import com.deepansh.kitchen.exception.PermanentAgentException;
import com.deepansh.kitchen.llm.StructuredOutputClient;
import com.deepansh.kitchen.model.AgentId;
import com.deepansh.kitchen.model.AgentOutput;
import com.deepansh.kitchen.model.Ingredient;
import com.deepansh.kitchen.model.InventoryResult;
import com.deepansh.kitchen.model.PantryItem;
import com.deepansh.kitchen.model.RecipeResult;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Generates a recipe for the requested dish.
 *
 * When the pantry check already ran, the recipe is adapted to what is in
 * stock and the ingredients the pantry lacks are reported as missing.
 */
@Component
@Slf4j
public class RecipeAgent implements KitchenAgent {

    static final String SYSTEM_MESSAGE = """
            You are a professional chef assistant. Generate a detailed recipe for the user's request.
            Include ingredients with quantities, step-by-step instructions, cooking time and servings.
            If a list of available ingredients is given, adapt the recipe to use them where sensible.
            Respect any dietary restrictions.
            """;

    static final Map<String, Object> OUTPUT_SCHEMA = Map.of(
            "type", "object",
            "properties", Map.of(
                    "dish_name", Map.of("type", "string"),
                    "ingredients", Map.of("type", "array", "items", Map.of(
                            "type", "object",
                            "properties", Map.of(
                                    "name", Map.of("type", "string"),
                                    "amount", Map.of("type", "string")))),
                    "instructions", Map.of("type", "array", "items", Map.of("type", "string")),
                    "cooking_time", Map.of("type", "string"),
                    "servings", Map.of("type", "integer")
            ),
            "required", List.of("dish_name", "ingredients", "instructions")
    );

    private final StructuredOutputClient structuredOutputClient;

    public RecipeAgent(StructuredOutputClient structuredOutputClient) {
        this.structuredOutputClient = structuredOutputClient;
    }

    @Override
    public AgentId id() {
        return AgentId.RECIPE;
    }

    @Override
    public AgentOutput execute(AgentInvocation invocation) {
        String dish = invocation.entity("dish").orElse(null);
        Optional<InventoryResult> pantry = invocation.priorOutputs().success(AgentId.INVENTORY, InventoryResult.class);

        StringBuilder prompt = new StringBuilder("Request: ").append(invocation.queryText());
        if (dish != null) {
            prompt.append("\nDish: ").append(dish);
        }
        invocation.entity("dietary_restrictions").ifPresent(d -> prompt.append("\nDietary restrictions: ").append(d));
        invocation.entity("ingredients").ifPresent(i -> prompt.append("\nUse these ingredients: ").append(i));
        pantry.filter(p -> !p.available().isEmpty()).ifPresent(p -> prompt.append("\nAvailable ingredients: ")
                .append(p.available().stream().map(PantryItem::name).collect(Collectors.joining(", "))));

        log.info("Generating recipe [dish={}, pantryAware={}, invocation={}]",
                dish, pantry.isPresent(), invocation.invocationId());

        JsonNode reply = AgentJson.ask(structuredOutputClient, id(), SYSTEM_MESSAGE, prompt.toString(), OUTPUT_SCHEMA);

        List<Ingredient> ingredients = AgentJson.ingredients(reply.get("ingredients"));
        if (ingredients.isEmpty()) {
            throw new PermanentAgentException("Recipe reply listed no ingredients");
        }

        List<Ingredient> missing = pantry
                .map(p -> missingFrom(ingredients, p.available()))
                .orElse(List.of());

        return new RecipeResult(
                AgentJson.text(reply, "dish_name", dish != null ? dish : "Suggested dish"),
                ingredients,
                missing,
                AgentJson.strings(reply.get("instructions")),
                AgentJson.text(reply, "cooking_time", "unknown"),
                Math.max(1, AgentJson.integer(reply, "servings", 1)));
    }

    private List<Ingredient> missingFrom(List<Ingredient> ingredients, List<PantryItem> available) {
        Set<String> stocked = available.stream()
                .map(item -> AgentJson.normalize(item.name()))
                .collect(Collectors.toSet());
        return ingredients.stream()
                .filter(i -> !stocked.contains(AgentJson.normalize(i.name())))
                .toList();
    }
}
