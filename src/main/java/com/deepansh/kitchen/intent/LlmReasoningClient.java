package com.deepansh.kitchen.intent;

import com.deepansh.kitchen.llm.Message;
import com.deepansh.kitchen.llm.StructuredOutputClient;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Reasoning collaborator backed by the configured LLM in JSON mode.
 */
@Component
@Slf4j
public class LlmReasoningClient implements ReasoningClient {

    static final String SYSTEM_MESSAGE = """
            You are the router of a kitchen assistant with four specialised agents:
            1. inventory: tracks the ingredients available in the user's kitchen
            2. recipe: generates recipes for a dish or from available ingredients
            3. shopping: compares grocery prices across Blinkit, Zepto and Instamart
            4. health: provides nutritional information and dietary advice

            Analyse the user query and decide which agents are needed.
            Extract entities such as dish, ingredients, quantity, dietary_restrictions,
            price_ceiling, platform and shopping_items (only when the user names what to buy).
            Add the signal "missing_ingredients" when shopping should buy what the recipe or
            inventory check finds missing, and "analyze_generated_recipe" when nutrition
            should be computed for the recipe being generated.

            Examples:
            - "What ingredients do I need for pasta?" -> agents [inventory, recipe]
            - "Give me a recipe for chicken curry" -> agents [recipe]
            - "Where can I buy tomatoes cheapest?" -> agents [shopping], shopping_items "tomatoes"
            - "How many calories in a pizza?" -> agents [recipe, health]
            - "Give me a biryani recipe, check what I'm missing and where to buy it cheapest"
              -> agents [recipe, inventory, shopping], signals [missing_ingredients]

            Use earlier turns of the conversation to resolve references such as "it" or "that dish".
            If the query is not about cooking, groceries or nutrition, return an empty agents list.
            """;

    static final Map<String, Object> OUTPUT_SCHEMA = Map.of(
            "type", "object",
            "properties", Map.of(
                    "agents", Map.of("type", "array", "items", Map.of("type", "string")),
                    "entities", Map.of("type", "object", "additionalProperties", Map.of("type", "string")),
                    "signals", Map.of("type", "array", "items", Map.of("type", "string")),
                    "confidence", Map.of("type", "number"),
                    "reasoning", Map.of("type", "string")
            ),
            "required", List.of("agents", "entities")
    );

    private final StructuredOutputClient structuredOutputClient;

    public LlmReasoningClient(StructuredOutputClient structuredOutputClient) {
        this.structuredOutputClient = structuredOutputClient;
    }

    @Override
    public JsonNode analyze(ReasoningRequest request) {
        List<Message> history = new ArrayList<>();
        for (ConversationTurn turn : request.conversationHistory()) {
            history.add(Message.user(turn.query()));
            if (turn.answerSummary() != null && !turn.answerSummary().isBlank()) {
                history.add(Message.assistant(turn.answerSummary()));
            }
        }

        log.debug("Routing query with {} history messages", history.size());
        return structuredOutputClient.requestJson(SYSTEM_MESSAGE, history,
                "Analyse this kitchen assistant query and choose the agents: " + request.text(),
                OUTPUT_SCHEMA);
    }
}
