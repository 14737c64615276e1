package com.deepansh.kitchen.agent.impl;

import com.deepansh.kitchen.agent.AgentInvocation;
import com.deepansh.kitchen.agent.KitchenAgent;
import com.deepansh.kitchen.exception.TransientAgentException;
import com.deepansh.kitchen.inventory.PantryItemDocument;
import com.deepansh.kitchen.inventory.PantryRepository;
import com.deepansh.kitchen.llm.StructuredOutputClient;
import com.deepansh.kitchen.model.AgentId;
import com.deepansh.kitchen.model.AgentOutput;
import com.deepansh.kitchen.model.Ingredient;
import com.deepansh.kitchen.model.InventoryResult;
import com.deepansh.kitchen.model.PantryItem;
import com.deepansh.kitchen.model.RecipeResult;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Checks the pantry stored in MongoDB.
 *
 * What the pantry lacks is worked out against, in order of preference:
 * a recipe that already completed, the dish named in the query (its
 * ingredient list comes from the LLM), or ingredients the user listed.
 * With none of these, only the pantry contents are returned.
 */
@Component
@Slf4j
public class InventoryAgent implements KitchenAgent {

    static final String SYSTEM_MESSAGE = "List the ingredients needed to cook the given dish.";

    static final Map<String, Object> OUTPUT_SCHEMA = Map.of(
            "type", "object",
            "properties", Map.of(
                    "ingredients", Map.of("type", "array", "items", Map.of(
                            "type", "object",
                            "properties", Map.of(
                                    "name", Map.of("type", "string"),
                                    "quantity", Map.of("type", "number"),
                                    "unit", Map.of("type", "string"))))
            ),
            "required", List.of("ingredients")
    );

    private final PantryRepository pantryRepository;
    private final StructuredOutputClient structuredOutputClient;

    public InventoryAgent(PantryRepository pantryRepository, StructuredOutputClient structuredOutputClient) {
        this.pantryRepository = pantryRepository;
        this.structuredOutputClient = structuredOutputClient;
    }

    @Override
    public AgentId id() {
        return AgentId.INVENTORY;
    }

    @Override
    public AgentOutput execute(AgentInvocation invocation) {
        List<PantryItem> available = loadPantry();
        List<Ingredient> needed = neededIngredients(invocation);

        Set<String> stocked = available.stream()
                .map(item -> AgentJson.normalize(item.name()))
                .collect(Collectors.toSet());
        List<Ingredient> missing = needed.stream()
                .filter(i -> !stocked.contains(AgentJson.normalize(i.name())))
                .toList();

        log.info("Pantry check: {} items in stock, {} needed, {} missing [invocation={}]",
                available.size(), needed.size(), missing.size(), invocation.invocationId());
        return new InventoryResult(available, missing);
    }

    private List<PantryItem> loadPantry() {
        try {
            return pantryRepository.findAllByOrderByNameAsc().stream()
                    .map(PantryItemDocument::toPantryItem)
                    .toList();
        } catch (DataAccessException e) {
            throw new TransientAgentException("Pantry store unavailable: " + e.getMessage(), e);
        }
    }

    private List<Ingredient> neededIngredients(AgentInvocation invocation) {
        Optional<RecipeResult> recipe = invocation.priorOutputs().success(AgentId.RECIPE, RecipeResult.class);
        if (recipe.isPresent()) {
            return recipe.get().ingredients();
        }

        Optional<String> dish = invocation.entity("dish");
        if (dish.isPresent()) {
            JsonNode reply = AgentJson.ask(structuredOutputClient, id(), SYSTEM_MESSAGE,
                    "What ingredients are needed to make " + dish.get() + "?", OUTPUT_SCHEMA);
            return AgentJson.ingredients(reply.get("ingredients"));
        }

        return invocation.entity("ingredients").map(AgentJson::splitNames).orElse(List.of());
    }
}
