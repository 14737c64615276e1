package com.deepansh.kitchen.nutrition;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;
import java.util.Map;

/**
 * Nutrition log entry written by the health agent.
 *
 * The id is the agent invocation id, so a retried invocation overwrites its
 * own entry instead of adding a second one.
 */
@Document(collection = "nutrition_records")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class NutritionRecord {

    @Id
    private String id;

    @Indexed
    private String sessionId;

    private String subject;
    private int caloriesPerServing;
    private Map<String, Double> macros;
    private String dietaryNotes;

    private Instant recordedAt;
}
