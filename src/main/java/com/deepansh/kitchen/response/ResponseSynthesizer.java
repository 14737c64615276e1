package com.deepansh.kitchen.response;

import com.deepansh.kitchen.model.AgentError;
import com.deepansh.kitchen.model.AgentId;
import com.deepansh.kitchen.model.AgentOutput;
import com.deepansh.kitchen.model.FinalResponse;
import com.deepansh.kitchen.model.HealthResult;
import com.deepansh.kitchen.model.Ingredient;
import com.deepansh.kitchen.model.Intent;
import com.deepansh.kitchen.model.InventoryResult;
import com.deepansh.kitchen.model.PantryItem;
import com.deepansh.kitchen.model.PlatformQuote;
import com.deepansh.kitchen.model.RecipeResult;
import com.deepansh.kitchen.model.ResponseSection;
import com.deepansh.kitchen.model.SectionStatus;
import com.deepansh.kitchen.model.ShoppingResult;
import com.deepansh.kitchen.model.WorkflowStatus;
import com.deepansh.kitchen.planner.ExecutionPlan;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Merges agent outputs into one sectioned answer.
 *
 * One section per required agent, in planner order:
 * - COMPLETED: rendered from the typed payload
 * - DEGRADED:  the agent ran and recorded an error
 * - SKIPPED:   the agent never ran (deadline or cancellation)
 * Every non-COMPLETED agent is also listed in the warnings.
 *
 * Rendering is deterministic and local; no reasoning collaborator is called here.
 */
@Component
@Slf4j
public class ResponseSynthesizer {

    public FinalResponse synthesize(Intent intent,
                                    ExecutionPlan plan,
                                    Map<AgentId, AgentOutput> outputs,
                                    Set<AgentId> completedAgents) {
        if (intent.isClarificationOnly()) {
            return FinalResponse.builder()
                    .status(WorkflowStatus.DONE)
                    .message(intent.clarification())
                    .build();
        }

        List<ResponseSection> sections = new ArrayList<>();
        List<AgentId> warnings = new ArrayList<>();

        for (AgentId agentId : plan.orderedAgents()) {
            AgentOutput output = completedAgents.contains(agentId) ? outputs.get(agentId) : null;
            ResponseSection section;

            if (output == null) {
                section = section(agentId, SectionStatus.SKIPPED,
                        label(agentId) + " was not run before the request ended.");
            } else if (output instanceof AgentError error) {
                section = section(agentId, SectionStatus.DEGRADED, degradedNotice(error));
            } else {
                section = section(agentId, SectionStatus.COMPLETED, render(agentId, output));
            }

            if (section.getStatus() != SectionStatus.COMPLETED) {
                warnings.add(agentId);
            }
            sections.add(section);
        }

        if (!warnings.isEmpty()) {
            log.warn("Response synthesized with incomplete sections: {}", warnings);
        }

        return FinalResponse.builder()
                .status(WorkflowStatus.DONE)
                .message(warnings.isEmpty() ? null : incompleteNotice(warnings))
                .sections(sections)
                .warnings(warnings)
                .build();
    }

    private String render(AgentId agentId, AgentOutput output) {
        return switch (agentId) {
            case RECIPE -> renderRecipe((RecipeResult) output);
            case INVENTORY -> renderInventory((InventoryResult) output);
            case SHOPPING -> renderShopping((ShoppingResult) output);
            case HEALTH -> renderHealth((HealthResult) output);
        };
    }

    private String renderRecipe(RecipeResult recipe) {
        StringBuilder sb = new StringBuilder(recipe.name());
        List<String> meta = new ArrayList<>();
        if (recipe.servings() > 0) {
            meta.add("serves " + recipe.servings());
        }
        if (recipe.cookingTime() != null && !recipe.cookingTime().isBlank()) {
            meta.add(recipe.cookingTime());
        }
        if (!meta.isEmpty()) {
            sb.append(" (").append(String.join(", ", meta)).append(')');
        }

        sb.append("\nIngredients:");
        recipe.ingredients().forEach(i -> sb.append("\n- ").append(formatIngredient(i)));

        if (!recipe.instructions().isEmpty()) {
            sb.append("\nSteps:");
            for (int i = 0; i < recipe.instructions().size(); i++) {
                sb.append('\n').append(i + 1).append(". ").append(recipe.instructions().get(i));
            }
        }
        if (!recipe.missingIngredients().isEmpty()) {
            sb.append("\nYou still need: ").append(joinNames(recipe.missingIngredients()));
        }
        return sb.toString();
    }

    private String renderInventory(InventoryResult inventory) {
        StringBuilder sb = new StringBuilder();
        if (inventory.available().isEmpty()) {
            sb.append("Your pantry is empty.");
        } else {
            sb.append("In your pantry: ").append(inventory.available().stream()
                    .map(this::formatPantryItem)
                    .collect(Collectors.joining(", ")));
        }
        if (inventory.missing().isEmpty()) {
            sb.append("\nYou have everything you need.");
        } else {
            sb.append("\nMissing: ").append(joinNames(inventory.missing()));
        }
        return sb.toString();
    }

    private String renderShopping(ShoppingResult shopping) {
        if (shopping.items().isEmpty()) {
            return "Nothing to buy.";
        }
        StringBuilder sb = new StringBuilder("Shopping list: ").append(joinNames(shopping.items()));
        for (PlatformQuote quote : shopping.quotes()) {
            sb.append("\n- ").append(quote.platform()).append(": ").append(formatPrice(quote.total()));
            if (quote.deliveryTime() != null && !quote.deliveryTime().isBlank()) {
                sb.append(", delivery ").append(quote.deliveryTime());
            }
        }
        if (!shopping.bestOption().isBlank()) {
            sb.append("\nCheapest: ").append(shopping.bestOption())
                    .append(" at ").append(formatPrice(shopping.totalCost()));
        }
        return sb.toString();
    }

    private String renderHealth(HealthResult health) {
        StringBuilder sb = new StringBuilder(health.subject())
                .append(": ").append(health.caloriesPerServing()).append(" kcal per serving");
        if (!health.macros().isEmpty()) {
            sb.append("\nMacros: ").append(health.macros().entrySet().stream()
                    .map(e -> e.getKey() + " " + formatGrams(e.getValue()))
                    .collect(Collectors.joining(", ")));
        }
        if (!health.dietaryNotes().isBlank()) {
            sb.append("\nNotes: ").append(health.dietaryNotes());
        }
        return sb.toString();
    }

    private String degradedNotice(AgentError error) {
        String cause = switch (error.kind()) {
            case RETRIES_EXHAUSTED -> "it kept failing after " + error.attempts() + " attempt(s)";
            case DEADLINE_EXCEEDED -> "the request ran out of time";
            case PERMANENT -> "it could not handle this request";
        };
        return label(error.agentId()) + " is unavailable right now because " + cause + ".";
    }

    private String incompleteNotice(List<AgentId> warnings) {
        return "Some parts of this answer are incomplete: "
                + warnings.stream().map(AgentId::wireName).collect(Collectors.joining(", "));
    }

    private String label(AgentId agentId) {
        return switch (agentId) {
            case RECIPE -> "Recipe suggestion";
            case INVENTORY -> "Pantry check";
            case SHOPPING -> "Price comparison";
            case HEALTH -> "Nutrition analysis";
        };
    }

    private static ResponseSection section(AgentId agentId, SectionStatus status, String content) {
        return ResponseSection.builder().agentId(agentId).status(status).content(content).build();
    }

    private static String formatIngredient(Ingredient ingredient) {
        return ingredient.amount().isEmpty() ? ingredient.name() : ingredient.name() + ": " + ingredient.amount();
    }

    private String formatPantryItem(PantryItem item) {
        return item.name() + " (" + trimDecimal(item.quantity()) + (item.unit() == null ? "" : " " + item.unit()) + ")";
    }

    private static String joinNames(List<Ingredient> ingredients) {
        return ingredients.stream().map(Ingredient::name).collect(Collectors.joining(", "));
    }

    private static String formatPrice(double amount) {
        return "₹" + String.format(Locale.ROOT, "%.2f", amount);
    }

    private static String formatGrams(double grams) {
        return trimDecimal(grams) + "g";
    }

    private static String trimDecimal(double value) {
        return value == Math.rint(value)
                ? String.valueOf((long) value)
                : String.format(Locale.ROOT, "%.1f", value);
    }
}
