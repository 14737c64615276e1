package com.deepansh.kitchen.model;

import java.util.List;

/**
 * Price comparison for a shopping list. An empty {@code items} list means
 * there was nothing to buy.
 */
public record ShoppingResult(List<Ingredient> items,
                             List<PlatformQuote> quotes,
                             String bestOption,
                             double totalCost) implements AgentOutput {

    public ShoppingResult {
        items = List.copyOf(items);
        quotes = List.copyOf(quotes);
        bestOption = bestOption == null ? "" : bestOption;
    }

    public static ShoppingResult nothingToBuy() {
        return new ShoppingResult(List.of(), List.of(), "", 0);
    }

    @Override
    public AgentId agentId() {
        return AgentId.SHOPPING;
    }
}
