package com.deepansh.kitchen.intent;

import com.deepansh.kitchen.exception.IntentResolutionException;
import com.deepansh.kitchen.exception.KitchenAssistantException;
import com.deepansh.kitchen.model.AgentId;
import com.deepansh.kitchen.model.DependencySignal;
import com.deepansh.kitchen.model.Intent;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Turns free-form text into an {@link Intent}.
 *
 * The reasoning collaborator's reply is treated as untrusted input:
 * - agent identifiers outside the closed set are dropped with a warning
 * - entity values must be scalars (arrays of scalars are joined); anything else is dropped
 * - confidence is clamped to [0, 1]
 *
 * A reply naming no usable agent yields a clarification-only intent.
 * Blank text, an unreachable collaborator, or a reply that is not an object
 * with an {@code agents} array raise {@link IntentResolutionException}.
 */
@Component
@Slf4j
public class IntentResolver {

    public static final String CLARIFICATION_PROMPT =
            "I can suggest recipes, check your pantry, compare grocery prices or look up nutrition. "
                    + "What would you like me to do?";

    public static final String SHOPPING_ITEMS_ENTITY = "shopping_items";
    public static final String INGREDIENTS_ENTITY = "ingredients";

    private static final List<String> AGENT_FIELDS = List.of("agents", "agent_flow", "required_agents");
    private static final double DEFAULT_CONFIDENCE = 0.5;

    private final ReasoningClient reasoningClient;

    public IntentResolver(ReasoningClient reasoningClient) {
        this.reasoningClient = reasoningClient;
    }

    public Intent resolve(String queryText, ConversationContext conversationContext) {
        if (queryText == null || queryText.isBlank()) {
            throw new IntentResolutionException("Query text is empty");
        }

        JsonNode reply;
        try {
            reply = reasoningClient.analyze(new ReasoningRequest(queryText, conversationContext.turns()));
        } catch (KitchenAssistantException e) {
            log.warn("Reasoning collaborator failed [session={}]: {}",
                    conversationContext.sessionId(), e.getMessage());
            throw new IntentResolutionException("Could not interpret the query: " + e.getMessage(), e);
        }

        if (reply == null || !reply.isObject()) {
            throw new IntentResolutionException("Reasoning reply is not a JSON object");
        }

        List<AgentId> agents = readAgents(reply);
        Map<String, String> entities = readEntities(reply.get("entities"));

        if (agents.isEmpty()) {
            log.info("No usable agent for query, asking for clarification [session={}]",
                    conversationContext.sessionId());
            return Intent.clarificationOnly(CLARIFICATION_PROMPT, entities);
        }

        Set<DependencySignal> signals = readSignals(reply.get("signals"));
        inferSignals(agents, entities, signals);

        Intent intent = new Intent(agents, entities, readConfidence(reply.get("confidence")), signals, null);
        log.info("Resolved intent [session={}, agents={}, signals={}, entities={}]",
                conversationContext.sessionId(), intent.requiredAgents(), intent.signals(), intent.entities().keySet());
        return intent;
    }

    private List<AgentId> readAgents(JsonNode reply) {
        JsonNode field = null;
        for (String name : AGENT_FIELDS) {
            if (reply.has(name)) {
                field = reply.get(name);
                break;
            }
        }
        if (field == null || !field.isArray()) {
            throw new IntentResolutionException("Reasoning reply has no 'agents' array");
        }

        Set<AgentId> agents = new LinkedHashSet<>();
        for (JsonNode element : field) {
            if (!element.isTextual()) {
                log.warn("Dropping non-string agent identifier: {}", element);
                continue;
            }
            AgentId.fromWireName(element.asText()).ifPresentOrElse(
                    agents::add,
                    () -> log.warn("Dropping unknown agent identifier '{}'", element.asText()));
        }
        return new ArrayList<>(agents);
    }

    private Map<String, String> readEntities(JsonNode node) {
        Map<String, String> entities = new LinkedHashMap<>();
        if (node == null || node.isNull()) {
            return entities;
        }
        if (!node.isObject()) {
            log.warn("Ignoring entities that are not an object: {}", node.getNodeType());
            return entities;
        }

        Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            String key = field.getKey().trim();
            JsonNode value = field.getValue();

            if (key.isEmpty() || value == null || value.isNull()) {
                continue;
            }
            if (value.isValueNode()) {
                putIfNotBlank(entities, key, value.asText());
            } else if (value.isArray() && allScalars(value)) {
                List<String> parts = new ArrayList<>();
                value.forEach(v -> parts.add(v.asText().trim()));
                putIfNotBlank(entities, key, String.join(", ", parts));
            } else {
                log.warn("Dropping structured entity '{}'", key);
            }
        }
        return entities;
    }

    private Set<DependencySignal> readSignals(JsonNode node) {
        Set<DependencySignal> signals = EnumSet.noneOf(DependencySignal.class);
        if (node == null || !node.isArray()) {
            return signals;
        }
        for (JsonNode element : node) {
            DependencySignal.fromWireName(element.asText()).ifPresentOrElse(
                    signals::add,
                    () -> log.debug("Ignoring unknown signal '{}'", element.asText()));
        }
        return signals;
    }

    /**
     * Shopping after Recipe/Inventory unless the user named what to buy;
     * Health after Recipe unless the user named standalone ingredients.
     */
    private void inferSignals(List<AgentId> agents, Map<String, String> entities, Set<DependencySignal> signals) {
        boolean shoppingFromFindings = agents.contains(AgentId.SHOPPING)
                && (agents.contains(AgentId.RECIPE) || agents.contains(AgentId.INVENTORY))
                && !entities.containsKey(SHOPPING_ITEMS_ENTITY);
        if (shoppingFromFindings) {
            signals.add(DependencySignal.MISSING_INGREDIENTS);
        }

        boolean healthOfRecipe = agents.contains(AgentId.HEALTH)
                && agents.contains(AgentId.RECIPE)
                && !entities.containsKey(INGREDIENTS_ENTITY);
        if (healthOfRecipe) {
            signals.add(DependencySignal.ANALYZE_GENERATED_RECIPE);
        }
    }

    private double readConfidence(JsonNode node) {
        if (node == null || !node.isNumber()) {
            return DEFAULT_CONFIDENCE;
        }
        return Math.max(0.0, Math.min(1.0, node.asDouble()));
    }

    private boolean allScalars(JsonNode array) {
        for (JsonNode element : array) {
            if (!element.isValueNode() || element.isNull()) {
                return false;
            }
        }
        return true;
    }

    private void putIfNotBlank(Map<String, String> entities, String key, String value) {
        if (value != null && !value.isBlank()) {
            entities.put(key, value.trim());
        }
    }
}
