package com.deepansh.kitchen.agent.impl;

import com.deepansh.kitchen.agent.AgentInvocation;
import com.deepansh.kitchen.agent.KitchenAgent;
import com.deepansh.kitchen.exception.PermanentAgentException;
import com.deepansh.kitchen.llm.StructuredOutputClient;
import com.deepansh.kitchen.model.AgentId;
import com.deepansh.kitchen.model.AgentOutput;
import com.deepansh.kitchen.model.DependencySignal;
import com.deepansh.kitchen.model.HealthResult;
import com.deepansh.kitchen.model.Ingredient;
import com.deepansh.kitchen.model.RecipeResult;
import com.deepansh.kitchen.nutrition.NutritionRecord;
import com.deepansh.kitchen.nutrition.NutritionRecordRepository;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Estimates calories and macros for a dish and logs the result.
 *
 * Analyses the generated recipe only when the intent asked for it and the
 * recipe completed; otherwise the dish or ingredients named in the query. The log entry is keyed by the
 * invocation id, so retries overwrite rather than duplicate it.
 */
@Component
@Slf4j
public class HealthAgent implements KitchenAgent {

    static final List<String> MACROS = List.of("protein", "carbs", "fat");

    static final String SYSTEM_MESSAGE = """
            You are a nutritionist assistant. Provide accurate nutritional information for the dish.
            Include calories per serving, a macronutrient breakdown in grams, and short dietary notes.
            """;

    static final Map<String, Object> OUTPUT_SCHEMA = Map.of(
            "type", "object",
            "properties", Map.of(
                    "calories_per_serving", Map.of("type", "integer"),
                    "macros", Map.of(
                            "type", "object",
                            "properties", Map.of(
                                    "protein", Map.of("type", "number"),
                                    "carbs", Map.of("type", "number"),
                                    "fat", Map.of("type", "number"))),
                    "dietary_notes", Map.of("type", "string")
            ),
            "required", List.of("calories_per_serving", "macros")
    );

    private final StructuredOutputClient structuredOutputClient;
    private final NutritionRecordRepository nutritionRecordRepository;

    public HealthAgent(StructuredOutputClient structuredOutputClient,
                       NutritionRecordRepository nutritionRecordRepository) {
        this.structuredOutputClient = structuredOutputClient;
        this.nutritionRecordRepository = nutritionRecordRepository;
    }

    @Override
    public AgentId id() {
        return AgentId.HEALTH;
    }

    @Override
    public AgentOutput execute(AgentInvocation invocation) {
        Optional<RecipeResult> recipe = invocation.hasSignal(DependencySignal.ANALYZE_GENERATED_RECIPE)
                ? invocation.priorOutputs().success(AgentId.RECIPE, RecipeResult.class)
                : Optional.empty();

        String subject;
        String prompt;
        if (recipe.isPresent()) {
            subject = recipe.get().name();
            prompt = "Calculate nutritional information for " + subject + " with these ingredients: "
                    + describe(recipe.get().ingredients());
        } else {
            subject = invocation.entity("dish")
                    .or(() -> invocation.entity("ingredients"))
                    .orElse(invocation.queryText());
            prompt = "Calculate nutritional information for: " + subject;
        }
        prompt += invocation.entity("dietary_restrictions").map(d -> "\nDietary restrictions: " + d).orElse("");

        JsonNode reply = AgentJson.ask(structuredOutputClient, id(), SYSTEM_MESSAGE, prompt, OUTPUT_SCHEMA);

        int calories = AgentJson.integer(reply, "calories_per_serving", -1);
        if (calories < 0) {
            throw new PermanentAgentException("Nutrition reply had no calories per serving");
        }
        HealthResult result = new HealthResult(subject, calories,
                readMacros(reply.get("macros")), AgentJson.text(reply, "dietary_notes", ""));

        logNutrition(invocation, result);
        log.info("Nutrition analysed for '{}': {} kcal [invocation={}]",
                subject, calories, invocation.invocationId());
        return result;
    }

    private Map<String, Double> readMacros(JsonNode node) {
        Map<String, Double> macros = new LinkedHashMap<>();
        if (node == null || !node.isObject()) {
            return macros;
        }
        for (String macro : MACROS) {
            double grams = AgentJson.number(node, macro, -1);
            if (grams >= 0) {
                macros.put(macro, grams);
            }
        }
        return macros;
    }

    private void logNutrition(AgentInvocation invocation, HealthResult result) {
        NutritionRecord record = NutritionRecord.builder()
                .id(invocation.invocationId())
                .sessionId(invocation.sessionId())
                .subject(result.subject())
                .caloriesPerServing(result.caloriesPerServing())
                .macros(result.macros())
                .dietaryNotes(result.dietaryNotes())
                .recordedAt(Instant.now())
                .build();
        try {
            nutritionRecordRepository.save(record);
        } catch (DataAccessException e) {
            // the analysis is still returned; only the log entry is lost
            log.warn("Failed to log nutrition record [invocation={}]: {}", invocation.invocationId(), e.getMessage());
        }
    }

    private static String describe(List<Ingredient> ingredients) {
        return ingredients.stream()
                .map(i -> i.amount().isEmpty() ? i.name() : i.amount() + " " + i.name())
                .collect(Collectors.joining(", "));
    }
}
