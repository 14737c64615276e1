package com.deepansh.kitchen.agent.impl;

import com.deepansh.kitchen.agent.AgentInvocation;
import com.deepansh.kitchen.agent.PriorOutputs;
import com.deepansh.kitchen.exception.TransientAgentException;
import com.deepansh.kitchen.inventory.PantryItemDocument;
import com.deepansh.kitchen.inventory.PantryRepository;
import com.deepansh.kitchen.llm.StructuredOutputClient;
import com.deepansh.kitchen.model.AgentId;
import com.deepansh.kitchen.model.Ingredient;
import com.deepansh.kitchen.model.InventoryResult;
import com.deepansh.kitchen.model.RecipeResult;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class InventoryAgentTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    @Mock PantryRepository pantryRepository;
    @Mock StructuredOutputClient structuredOutputClient;

    InventoryAgent agent;

    @BeforeEach
    void setUp() {
        agent = new InventoryAgent(pantryRepository, structuredOutputClient);
    }

    @Test
    void execute_afterRecipe_comparesRecipeIngredientsWithoutLlmCall() {
        stockPantry();
        RecipeResult recipe = new RecipeResult("Tomato Rice",
                List.of(new Ingredient("Rice", "1 cup"), new Ingredient("tomatoes", "2"), new Ingredient("curry leaves", "")),
                List.of(), List.of("Cook"), "20 minutes", 2);

        InventoryResult result = (InventoryResult) agent.execute(invocation(Map.of("dish", "tomato rice"),
                PriorOutputs.snapshotOf(Map.of(AgentId.RECIPE, recipe))));

        assertThat(result.available()).hasSize(3);
        assertThat(result.missing()).extracting(Ingredient::name).containsExactly("curry leaves");
        verifyNoInteractions(structuredOutputClient);
    }

    @Test
    void execute_dishOnly_asksLlmForIngredients() throws Exception {
        stockPantry();
        when(structuredOutputClient.requestJson(anyString(), contains("biryani"), anyMap())).thenReturn(objectMapper.readTree("""
                {"ingredients": [{"name": "rice", "quantity": 2, "unit": "cups"},
                                 {"name": "chicken", "quantity": 500, "unit": "g"},
                                 {"name": "saffron"}]}
                """));

        InventoryResult result = (InventoryResult) agent.execute(invocation(Map.of("dish", "biryani"), PriorOutputs.empty()));

        assertThat(result.missing()).extracting(Ingredient::name).containsExactly("chicken", "saffron");
    }

    @Test
    void execute_listedIngredients_comparesThemWithPantry() {
        stockPantry();

        InventoryResult result = (InventoryResult) agent.execute(
                invocation(Map.of("ingredients", "onions, Rice, paneer"), PriorOutputs.empty()));

        assertThat(result.missing()).extracting(Ingredient::name).containsExactly("paneer");
    }

    @Test
    void execute_nothingToCompare_returnsPantryOnly() {
        stockPantry();

        InventoryResult result = (InventoryResult) agent.execute(invocation(Map.of(), PriorOutputs.empty()));

        assertThat(result.available()).extracting(p -> p.name()).containsExactly("onion", "rice", "tomato");
        assertThat(result.missing()).isEmpty();
    }

    @Test
    void execute_pantryStoreDown_isTransient() {
        when(pantryRepository.findAllByOrderByNameAsc()).thenThrow(new DataAccessResourceFailureException("mongo down"));

        assertThatThrownBy(() -> agent.execute(invocation(Map.of(), PriorOutputs.empty())))
                .isInstanceOf(TransientAgentException.class);
    }

    private void stockPantry() {
        when(pantryRepository.findAllByOrderByNameAsc()).thenReturn(List.of(
                PantryItemDocument.builder().name("onion").quantity(5).unit("pieces").build(),
                PantryItemDocument.builder().name("rice").quantity(500).unit("g").build(),
                PantryItemDocument.builder().name("tomato").quantity(3).unit("pieces").build()));
    }

    private static AgentInvocation invocation(Map<String, String> entities, PriorOutputs prior) {
        return new AgentInvocation("req-1:inventory", "s1", "What am I missing?", entities, prior);
    }
}
