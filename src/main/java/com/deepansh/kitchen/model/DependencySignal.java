package com.deepansh.kitchen.model;

import java.util.Locale;
import java.util.Optional;

/**
 * Data-dependency hints attached to an {@link Intent}. A planner edge is only
 * active when its signal is present.
 */
public enum DependencySignal {

    /** Shopping prices the ingredients Recipe/Inventory found missing. */
    MISSING_INGREDIENTS("missing_ingredients"),

    /** Health analyses the recipe generated in this request. */
    ANALYZE_GENERATED_RECIPE("analyze_generated_recipe");

    private final String wireName;

    DependencySignal(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    public static Optional<DependencySignal> fromWireName(String raw) {
        if (raw == null) {
            return Optional.empty();
        }
        String normalized = raw.trim().toLowerCase(Locale.ROOT);
        for (DependencySignal signal : values()) {
            if (signal.wireName.equals(normalized)) {
                return Optional.of(signal);
            }
        }
        return Optional.empty();
    }
}
