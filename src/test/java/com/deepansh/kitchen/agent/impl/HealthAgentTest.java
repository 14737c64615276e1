package com.deepansh.kitchen.agent.impl;

import com.deepansh.kitchen.agent.AgentInvocation;
import com.deepansh.kitchen.agent.PriorOutputs;
import com.deepansh.kitchen.exception.PermanentAgentException;
import com.deepansh.kitchen.llm.StructuredOutputClient;
import com.deepansh.kitchen.model.AgentId;
import com.deepansh.kitchen.model.DependencySignal;
import com.deepansh.kitchen.model.HealthResult;
import com.deepansh.kitchen.model.Ingredient;
import com.deepansh.kitchen.model.RecipeResult;
import com.deepansh.kitchen.nutrition.NutritionRecord;
import com.deepansh.kitchen.nutrition.NutritionRecordRepository;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class HealthAgentTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    @Mock StructuredOutputClient structuredOutputClient;
    @Mock NutritionRecordRepository nutritionRecordRepository;

    HealthAgent agent;

    @BeforeEach
    void setUp() {
        agent = new HealthAgent(structuredOutputClient, nutritionRecordRepository);
    }

    @Test
    void execute_afterRecipe_analysesRecipeAndLogsRecordUnderInvocationId() throws Exception {
        when(structuredOutputClient.requestJson(anyString(), anyString(), anyMap())).thenReturn(objectMapper.readTree("""
                {"calories_per_serving": 550,
                 "macros": {"protein": 30, "carbs": "62.5", "fat": 18, "fiber": 4},
                 "dietary_notes": "High in sodium"}
                """));
        RecipeResult recipe = new RecipeResult("Chicken Biryani",
                List.of(new Ingredient("rice", "2 cups"), new Ingredient("chicken", "")),
                List.of(), List.of("Cook"), "1 hour", 4);

        HealthResult result = (HealthResult) agent.execute(new AgentInvocation("req-1:health", "s1",
                "How healthy is it?", Map.of(), Set.of(DependencySignal.ANALYZE_GENERATED_RECIPE),
                PriorOutputs.snapshotOf(Map.of(AgentId.RECIPE, recipe))));

        assertThat(result.subject()).isEqualTo("Chicken Biryani");
        assertThat(result.caloriesPerServing()).isEqualTo(550);
        assertThat(result.macros()).containsOnlyKeys("protein", "carbs", "fat").containsEntry("carbs", 62.5);
        verify(structuredOutputClient).requestJson(anyString(), contains("2 cups rice, chicken"), anyMap());

        ArgumentCaptor<NutritionRecord> saved = ArgumentCaptor.forClass(NutritionRecord.class);
        verify(nutritionRecordRepository).save(saved.capture());
        assertThat(saved.getValue().getId()).isEqualTo("req-1:health");
        assertThat(saved.getValue().getSessionId()).isEqualTo("s1");
    }

    @Test
    void execute_ingredientsEntityWithCompletedRecipe_analysesIngredients() throws Exception {
        when(structuredOutputClient.requestJson(anyString(), anyString(), anyMap()))
                .thenReturn(objectMapper.readTree("{\"calories_per_serving\": 310, \"macros\": {\"protein\": 12}}"));
        RecipeResult recipe = new RecipeResult("Chicken Biryani",
                List.of(new Ingredient("rice", "2 cups")), List.of(), List.of("Cook"), "1 hour", 4);

        HealthResult result = (HealthResult) agent.execute(invocation(Map.of("ingredients", "oats, milk"),
                PriorOutputs.snapshotOf(Map.of(AgentId.RECIPE, recipe))));

        assertThat(result.subject()).isEqualTo("oats, milk");
        verify(structuredOutputClient).requestJson(anyString(),
                eq("Calculate nutritional information for: oats, milk"), anyMap());
    }

    @Test
    void execute_recipeSignalButRecipeFailed_fallsBackToDish() throws Exception {
        when(structuredOutputClient.requestJson(anyString(), anyString(), anyMap()))
                .thenReturn(objectMapper.readTree("{\"calories_per_serving\": 600, \"macros\": {}}"));

        HealthResult result = (HealthResult) agent.execute(new AgentInvocation("req-1:health", "s1",
                "How healthy is it?", Map.of("dish", "biryani"), Set.of(DependencySignal.ANALYZE_GENERATED_RECIPE),
                PriorOutputs.empty()));

        assertThat(result.subject()).isEqualTo("biryani");
    }

    @Test
    void execute_standaloneDish_usesEntityAndDietaryRestrictions() throws Exception {
        when(structuredOutputClient.requestJson(anyString(), anyString(), anyMap()))
                .thenReturn(objectMapper.readTree("{\"calories_per_serving\": 280, \"macros\": {}}"));

        HealthResult result = (HealthResult) agent.execute(invocation(
                Map.of("dish", "pizza", "dietary_restrictions", "diabetic"), PriorOutputs.empty()));

        assertThat(result.subject()).isEqualTo("pizza");
        assertThat(result.macros()).isEmpty();
        verify(structuredOutputClient).requestJson(anyString(),
                eq("Calculate nutritional information for: pizza\nDietary restrictions: diabetic"), anyMap());
    }

    @Test
    void execute_noCalories_failsPermanentlyWithoutLogging() throws Exception {
        when(structuredOutputClient.requestJson(anyString(), anyString(), anyMap()))
                .thenReturn(objectMapper.readTree("{\"macros\": {\"protein\": 10}}"));

        assertThatThrownBy(() -> agent.execute(invocation(Map.of("dish", "pizza"), PriorOutputs.empty())))
                .isInstanceOf(PermanentAgentException.class);
        verifyNoInteractions(nutritionRecordRepository);
    }

    @Test
    void execute_logStoreDown_stillReturnsAnalysis() throws Exception {
        when(structuredOutputClient.requestJson(anyString(), anyString(), anyMap()))
                .thenReturn(objectMapper.readTree("{\"calories_per_serving\": 120, \"macros\": {\"protein\": 2}}"));
        when(nutritionRecordRepository.save(any())).thenThrow(new DataAccessResourceFailureException("mongo down"));

        HealthResult result = (HealthResult) agent.execute(invocation(Map.of("ingredients", "apple"), PriorOutputs.empty()));

        assertThat(result.subject()).isEqualTo("apple");
        assertThat(result.caloriesPerServing()).isEqualTo(120);
    }

    private static AgentInvocation invocation(Map<String, String> entities, PriorOutputs prior) {
        return new AgentInvocation("req-1:health", "s1", "How healthy is it?", entities, prior);
    }
}
