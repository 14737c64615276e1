package com.deepansh.kitchen.agent.impl;

import com.deepansh.kitchen.agent.AgentInvocation;
import com.deepansh.kitchen.agent.KitchenAgent;
import com.deepansh.kitchen.agent.PriorOutputs;
import com.deepansh.kitchen.exception.PermanentAgentException;
import com.deepansh.kitchen.llm.StructuredOutputClient;
import com.deepansh.kitchen.model.AgentId;
import com.deepansh.kitchen.model.AgentOutput;
import com.deepansh.kitchen.model.Ingredient;
import com.deepansh.kitchen.model.InventoryResult;
import com.deepansh.kitchen.model.PlatformQuote;
import com.deepansh.kitchen.model.RecipeResult;
import com.deepansh.kitchen.model.ShoppingResult;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Compares basket prices across Blinkit, Zepto and Instamart.
 *
 * The shopping list is the user's explicit {@code shopping_items} entity if
 * present, otherwise the missing ingredients reported by the recipe and
 * pantry agents that already completed. The cheapest quote wins.
 */
@Component
@Slf4j
public class ShoppingAgent implements KitchenAgent {

    static final List<String> PLATFORMS = List.of("blinkit", "zepto", "instamart");

    static final String SYSTEM_MESSAGE = """
            You are a shopping assistant that compares prices across grocery delivery platforms.
            Estimate the basket total in INR and the delivery time for Blinkit, Zepto and Instamart.
            """;

    private static final Map<String, Object> QUOTE_SCHEMA = Map.of(
            "type", "object",
            "properties", Map.of(
                    "total", Map.of("type", "number"),
                    "delivery_time", Map.of("type", "string")));

    static final Map<String, Object> OUTPUT_SCHEMA = Map.of(
            "type", "object",
            "properties", Map.of(
                    "platform_comparisons", Map.of(
                            "type", "object",
                            "properties", Map.of(
                                    "blinkit", QUOTE_SCHEMA,
                                    "zepto", QUOTE_SCHEMA,
                                    "instamart", QUOTE_SCHEMA)),
                    "best_option", Map.of("type", "string"),
                    "total_cost", Map.of("type", "number")
            ),
            "required", List.of("platform_comparisons")
    );

    private final StructuredOutputClient structuredOutputClient;

    public ShoppingAgent(StructuredOutputClient structuredOutputClient) {
        this.structuredOutputClient = structuredOutputClient;
    }

    @Override
    public AgentId id() {
        return AgentId.SHOPPING;
    }

    @Override
    public AgentOutput execute(AgentInvocation invocation) {
        List<Ingredient> items = invocation.entity("shopping_items")
                .map(AgentJson::splitNames)
                .orElseGet(() -> missingFromPriorOutputs(invocation.priorOutputs()));

        if (items.isEmpty()) {
            log.info("Nothing to buy [invocation={}]", invocation.invocationId());
            return ShoppingResult.nothingToBuy();
        }

        String list = items.stream()
                .map(i -> i.amount().isEmpty() ? i.name() : i.amount() + " " + i.name())
                .collect(Collectors.joining(", "));
        JsonNode reply = AgentJson.ask(structuredOutputClient, id(), SYSTEM_MESSAGE,
                "Compare prices for these ingredients across Blinkit, Zepto and Instamart: " + list,
                OUTPUT_SCHEMA);

        List<PlatformQuote> quotes = readQuotes(reply.get("platform_comparisons"));
        if (quotes.isEmpty()) {
            throw new PermanentAgentException("Price comparison reply had no platform quotes");
        }

        PlatformQuote cheapest = quotes.stream()
                .min(Comparator.comparingDouble(PlatformQuote::total))
                .orElseThrow();

        log.info("Compared {} platforms for {} items, cheapest {} at {} [invocation={}]",
                quotes.size(), items.size(), cheapest.platform(), cheapest.total(), invocation.invocationId());
        return new ShoppingResult(items, quotes, cheapest.platform(), cheapest.total());
    }

    private List<Ingredient> missingFromPriorOutputs(PriorOutputs prior) {
        Map<String, Ingredient> byName = new LinkedHashMap<>();
        prior.success(AgentId.RECIPE, RecipeResult.class)
                .ifPresent(r -> r.missingIngredients().forEach(i -> byName.putIfAbsent(AgentJson.normalize(i.name()), i)));
        prior.success(AgentId.INVENTORY, InventoryResult.class)
                .ifPresent(r -> r.missing().forEach(i -> byName.putIfAbsent(AgentJson.normalize(i.name()), i)));
        return new ArrayList<>(byName.values());
    }

    private List<PlatformQuote> readQuotes(JsonNode comparisons) {
        List<PlatformQuote> quotes = new ArrayList<>();
        if (comparisons == null) {
            return quotes;
        }
        if (comparisons.isObject()) {
            Iterator<Map.Entry<String, JsonNode>> fields = comparisons.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                addQuote(quotes, field.getKey(), field.getValue());
            }
        } else if (comparisons.isArray()) {
            for (JsonNode element : comparisons) {
                addQuote(quotes, AgentJson.text(element, "platform", ""), element);
            }
        }
        return quotes;
    }

    private void addQuote(List<PlatformQuote> quotes, String platform, JsonNode node) {
        String name = platform.trim().toLowerCase(Locale.ROOT);
        if (!PLATFORMS.contains(name) || node == null || !node.isObject()) {
            log.debug("Ignoring quote for unsupported platform '{}'", platform);
            return;
        }
        double total = AgentJson.number(node, "total", -1);
        if (total < 0) {
            log.debug("Ignoring quote without a total for {}", name);
            return;
        }
        quotes.add(new PlatformQuote(name, total, AgentJson.text(node, "delivery_time", "")));
    }
}
