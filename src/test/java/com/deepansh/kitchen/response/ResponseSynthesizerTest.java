package com.deepansh.kitchen.response;

import com.deepansh.kitchen.model.AgentError;
import com.deepansh.kitchen.model.AgentId;
import com.deepansh.kitchen.model.AgentOutput;
import com.deepansh.kitchen.model.DependencySignal;
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
import org.junit.jupiter.api.Test;

import java.util.EnumMap;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static com.deepansh.kitchen.model.AgentId.HEALTH;
import static com.deepansh.kitchen.model.AgentId.INVENTORY;
import static com.deepansh.kitchen.model.AgentId.RECIPE;
import static com.deepansh.kitchen.model.AgentId.SHOPPING;
import static org.assertj.core.api.Assertions.assertThat;

class ResponseSynthesizerTest {

    private final ResponseSynthesizer synthesizer = new ResponseSynthesizer();

    private static final RecipeResult RECIPE_RESULT = new RecipeResult("Chicken Biryani",
            List.of(new Ingredient("rice", "2 cups"), new Ingredient("saffron", "")),
            List.of(new Ingredient("saffron", "")),
            List.of("Soak the rice", "Cook on dum"), "60 minutes", 4);

    @Test
    void synthesize_recipeAndHealth_returnsExactlyTwoSectionsInPlanOrder() {
        Map<String, Double> macros = new LinkedHashMap<>();
        macros.put("protein", 30.0);
        macros.put("carbs", 62.5);
        Map<AgentId, AgentOutput> outputs = outputs(RECIPE_RESULT,
                new HealthResult("Chicken Biryani", 550, macros, "High in sodium"));

        FinalResponse response = synthesizer.synthesize(intent(RECIPE, HEALTH),
                plan(List.of(RECIPE), List.of(HEALTH)), outputs, outputs.keySet());

        assertThat(response.getStatus()).isEqualTo(WorkflowStatus.DONE);
        assertThat(response.getSections()).hasSize(2);
        assertThat(response.getSections()).extracting(ResponseSection::getAgentId).containsExactly(RECIPE, HEALTH);
        assertThat(response.getWarnings()).isEmpty();
        assertThat(response.getMessage()).isNull();
        assertThat(response.getSections().get(1).getContent())
                .isEqualTo("Chicken Biryani: 550 kcal per serving\nMacros: protein 30g, carbs 62.5g\nNotes: High in sodium");
    }

    @Test
    void synthesize_recipe_rendersIngredientsStepsAndMissing() {
        Map<AgentId, AgentOutput> outputs = outputs(RECIPE_RESULT);

        FinalResponse response = synthesizer.synthesize(intent(RECIPE), plan(List.of(RECIPE)), outputs, outputs.keySet());

        assertThat(response.getSections().get(0).getContent()).isEqualTo("""
                Chicken Biryani (serves 4, 60 minutes)
                Ingredients:
                - rice: 2 cups
                - saffron
                Steps:
                1. Soak the rice
                2. Cook on dum
                You still need: saffron""");
    }

    @Test
    void synthesize_inventoryAndShopping_rendersPantryAndCheapestPlatform() {
        Map<AgentId, AgentOutput> outputs = outputs(
                new InventoryResult(List.of(new PantryItem("rice", 500, "g"), new PantryItem("onion", 2.5, "kg")),
                        List.of(new Ingredient("saffron", ""))),
                new ShoppingResult(List.of(new Ingredient("saffron", "")),
                        List.of(new PlatformQuote("blinkit", 120, "10 mins"), new PlatformQuote("zepto", 99.5, "")),
                        "zepto", 99.5));

        FinalResponse response = synthesizer.synthesize(intent(INVENTORY, SHOPPING),
                plan(List.of(INVENTORY), List.of(SHOPPING)), outputs, outputs.keySet());

        assertThat(response.getSections().get(0).getContent())
                .isEqualTo("In your pantry: rice (500 g), onion (2.5 kg)\nMissing: saffron");
        assertThat(response.getSections().get(1).getContent())
                .isEqualTo("Shopping list: saffron\n- blinkit: ₹120.00, delivery 10 mins\n- zepto: ₹99.50\nCheapest: zepto at ₹99.50");
    }

    @Test
    void synthesize_nothingToBuy_rendersShortNotice() {
        Map<AgentId, AgentOutput> outputs = outputs(ShoppingResult.nothingToBuy());

        FinalResponse response = synthesizer.synthesize(intent(SHOPPING), plan(List.of(SHOPPING)), outputs, outputs.keySet());

        assertThat(response.getSections().get(0).getContent()).isEqualTo("Nothing to buy.");
    }

    @Test
    void synthesize_agentError_marksSectionDegradedAndWarns() {
        Map<AgentId, AgentOutput> outputs = outputs(RECIPE_RESULT,
                new AgentError(SHOPPING, "blinkit unreachable", AgentError.Kind.RETRIES_EXHAUSTED, 3));

        FinalResponse response = synthesizer.synthesize(intent(RECIPE, SHOPPING),
                plan(List.of(RECIPE), List.of(SHOPPING)), outputs, outputs.keySet());

        ResponseSection shopping = response.getSections().get(1);
        assertThat(shopping.getStatus()).isEqualTo(SectionStatus.DEGRADED);
        assertThat(shopping.getContent())
                .isEqualTo("Price comparison is unavailable right now because it kept failing after 3 attempt(s).");
        assertThat(response.getWarnings()).containsExactly(SHOPPING);
        assertThat(response.getMessage()).isEqualTo("Some parts of this answer are incomplete: shopping");
    }

    @Test
    void synthesize_notCompleted_marksSectionSkipped() {
        Map<AgentId, AgentOutput> outputs = outputs(RECIPE_RESULT);

        FinalResponse response = synthesizer.synthesize(intent(RECIPE, HEALTH),
                plan(List.of(RECIPE), List.of(HEALTH)), outputs, outputs.keySet());

        assertThat(response.getSections().get(1).getStatus()).isEqualTo(SectionStatus.SKIPPED);
        assertThat(response.getSections().get(1).getContent())
                .isEqualTo("Nutrition analysis was not run before the request ended.");
        assertThat(response.getWarnings()).containsExactly(HEALTH);
    }

    @Test
    void synthesize_deadlineExceeded_explainsTimeout() {
        Map<AgentId, AgentOutput> outputs = outputs(
                new AgentError(HEALTH, "deadline", AgentError.Kind.DEADLINE_EXCEEDED, 2));

        FinalResponse response = synthesizer.synthesize(intent(HEALTH), plan(List.of(HEALTH)), outputs, outputs.keySet());

        assertThat(response.getSections().get(0).getContent()).endsWith("because the request ran out of time.");
    }

    @Test
    void synthesize_clarificationOnly_returnsMessageWithoutSections() {
        Intent intent = Intent.clarificationOnly("What would you like me to cook?", Map.of());

        FinalResponse response = synthesizer.synthesize(intent, ExecutionPlan.empty(), Map.of(), Set.of());

        assertThat(response.getMessage()).isEqualTo("What would you like me to cook?");
        assertThat(response.getSections()).isEmpty();
        assertThat(response.getWarnings()).isEmpty();
    }

    @SafeVarargs
    private static ExecutionPlan plan(List<AgentId>... waves) {
        return new ExecutionPlan(List.of(waves));
    }

    private static Intent intent(AgentId... agents) {
        return new Intent(List.of(agents), Map.of(), 0.9, EnumSet.noneOf(DependencySignal.class), null);
    }

    private static Map<AgentId, AgentOutput> outputs(AgentOutput... outputs) {
        Map<AgentId, AgentOutput> map = new EnumMap<>(AgentId.class);
        for (AgentOutput output : outputs) {
            map.put(output.agentId(), output);
        }
        return map;
    }
}
