package com.deepansh.kitchen.agent.impl;

import com.deepansh.kitchen.exception.LlmException;
import com.deepansh.kitchen.exception.PermanentAgentException;
import com.deepansh.kitchen.exception.TransientAgentException;
import com.deepansh.kitchen.llm.StructuredOutputClient;
import com.deepansh.kitchen.model.AgentId;
import com.deepansh.kitchen.model.Ingredient;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Iterator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;

/**
 * Shared plumbing for the LLM-backed agents: the structured call with error
 * classification, and lenient readers for the reply tree.
 */
final class AgentJson {

    private AgentJson() {
    }

    /**
     * Structured LLM call. Retryable provider errors become transient agent
     * failures, everything else permanent.
     */
    static JsonNode ask(StructuredOutputClient client, AgentId agentId,
                        String systemMessage, String prompt, Map<String, Object> schema) {
        try {
            return client.requestJson(systemMessage, prompt, schema);
        } catch (LlmException e) {
            String message = agentId.wireName() + " LLM call failed: " + e.getMessage();
            if (e.isRetryable()) {
                throw new TransientAgentException(message, e);
            }
            throw new PermanentAgentException(message, e);
        }
    }

    static String text(JsonNode node, String field, String fallback) {
        JsonNode value = node.get(field);
        if (value == null || !value.isValueNode() || value.isNull() || value.asText().isBlank()) {
            return fallback;
        }
        return value.asText().trim();
    }

    static int integer(JsonNode node, String field, int fallback) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return fallback;
        }
        if (value.isNumber()) {
            return value.asInt();
        }
        return value.isTextual() ? value.asInt(fallback) : fallback;
    }

    static double number(JsonNode node, String field, double fallback) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return fallback;
        }
        if (value.isNumber()) {
            return value.asDouble();
        }
        return value.isTextual() ? value.asDouble(fallback) : fallback;
    }

    /**
     * Reads an ingredient list. Accepts an array of objects
     * ({@code name} plus {@code amount}, or {@code quantity} and {@code unit}),
     * an array of plain names, or an object mapping name to amount.
     */
    static List<Ingredient> ingredients(JsonNode node) {
        List<Ingredient> result = new ArrayList<>();
        if (node == null || node.isNull()) {
            return result;
        }
        if (node.isArray()) {
            for (JsonNode element : node) {
                if (element.isTextual()) {
                    addIfNamed(result, new Ingredient(element.asText(), ""));
                } else if (element.isObject()) {
                    addIfNamed(result, new Ingredient(text(element, "name", ""), amountOf(element)));
                }
            }
        } else if (node.isObject()) {
            Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                addIfNamed(result, new Ingredient(field.getKey(), field.getValue().asText("")));
            }
        }
        return result;
    }

    /**
     * Reads a list of strings. An object is read as numbered steps ordered by key.
     */
    static List<String> strings(JsonNode node) {
        List<String> result = new ArrayList<>();
        if (node == null || node.isNull()) {
            return result;
        }
        if (node.isArray()) {
            node.forEach(element -> {
                if (element.isValueNode() && !element.asText().isBlank()) {
                    result.add(element.asText().trim());
                }
            });
        } else if (node.isObject()) {
            Map<String, String> ordered = new TreeMap<>(AgentJson::compareStepKeys);
            node.fields().forEachRemaining(e -> ordered.put(e.getKey(), e.getValue().asText()));
            ordered.values().stream().filter(s -> !s.isBlank()).map(String::trim).forEach(result::add);
        } else if (node.isTextual() && !node.asText().isBlank()) {
            result.add(node.asText().trim());
        }
        return result;
    }

    /** Splits a comma separated entity value into ingredient names. */
    static List<Ingredient> splitNames(String csv) {
        return Arrays.stream(csv.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .map(s -> new Ingredient(s, ""))
                .toList();
    }

    /** Lower-case singular form used to compare ingredient names. */
    static String normalize(String name) {
        String n = name.trim().toLowerCase(Locale.ROOT);
        if (n.endsWith("es") && n.length() > 4 && (n.endsWith("oes") || n.endsWith("shes") || n.endsWith("ches"))) {
            return n.substring(0, n.length() - 2);
        }
        if (n.endsWith("s") && !n.endsWith("ss") && n.length() > 3) {
            return n.substring(0, n.length() - 1);
        }
        return n;
    }

    private static String amountOf(JsonNode element) {
        String amount = text(element, "amount", "");
        if (!amount.isEmpty()) {
            return amount;
        }
        String quantity = text(element, "quantity", "");
        String unit = text(element, "unit", "");
        return (quantity + " " + unit).trim();
    }

    private static void addIfNamed(List<Ingredient> target, Ingredient ingredient) {
        if (!ingredient.name().isEmpty()) {
            target.add(ingredient);
        }
    }

    private static int compareStepKeys(String a, String b) {
        String da = a.replaceAll("\\D", "");
        String db = b.replaceAll("\\D", "");
        if (!da.isEmpty() && !db.isEmpty() && da.length() < 19 && db.length() < 19) {
            int byNumber = Long.compare(Long.parseLong(da), Long.parseLong(db));
            if (byNumber != 0) {
                return byNumber;
            }
        }
        return a.compareTo(b);
    }
}
