package com.deepansh.kitchen.core;

import com.deepansh.kitchen.model.HealthResult;
import com.deepansh.kitchen.model.Ingredient;
import com.deepansh.kitchen.model.InventoryResult;
import com.deepansh.kitchen.model.PantryItem;
import com.deepansh.kitchen.model.PlatformQuote;
import com.deepansh.kitchen.model.RecipeResult;
import com.deepansh.kitchen.model.ShoppingResult;

import java.util.List;
import java.util.Map;

/** Canned agent payloads for the biryani scenario. */
final class Fixtures {

    private Fixtures() {
    }

    static InventoryResult pantry() {
        return new InventoryResult(
                List.of(new PantryItem("rice", 500, "g"), new PantryItem("chicken", 1, "kg")),
                List.of(new Ingredient("saffron", "1 pinch")));
    }

    static RecipeResult biryani() {
        return new RecipeResult("Chicken Biryani",
                List.of(new Ingredient("rice", "2 cups"), new Ingredient("chicken", "500 g"),
                        new Ingredient("saffron", "1 pinch")),
                List.of(new Ingredient("saffron", "1 pinch")),
                List.of("Marinate the chicken", "Par-boil the rice", "Layer and cook on dum"),
                "60 minutes", 4);
    }

    static ShoppingResult saffronQuotes() {
        return new ShoppingResult(List.of(new Ingredient("saffron", "1 pinch")),
                List.of(new PlatformQuote("blinkit", 120, "10 mins"), new PlatformQuote("zepto", 110, "12 mins")),
                "zepto", 110);
    }

    static HealthResult nutrition() {
        return new HealthResult("Chicken Biryani", 550, Map.of("protein", 30.0), "High in carbohydrates");
    }
}
