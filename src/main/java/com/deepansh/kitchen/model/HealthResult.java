package com.deepansh.kitchen.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Nutrition estimate. Macros are grams keyed by name (protein, carbs, fat ...).
 */
public record HealthResult(String subject,
                           int caloriesPerServing,
                           Map<String, Double> macros,
                           String dietaryNotes) implements AgentOutput {

    public HealthResult {
        macros = Collections.unmodifiableMap(new LinkedHashMap<>(macros));
        dietaryNotes = dietaryNotes == null ? "" : dietaryNotes;
    }

    @Override
    public AgentId agentId() {
        return AgentId.HEALTH;
    }
}
