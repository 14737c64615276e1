package com.deepansh.kitchen.model;

/**
 * An ingredient with a free-form amount ("2 cups", "500 g").
 */
public record Ingredient(String name, String amount) {

    public Ingredient {
        name = name == null ? "" : name.trim();
        amount = amount == null ? "" : amount.trim();
    }
}
