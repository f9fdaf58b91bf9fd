package com.autolens.insight.market;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;
import java.util.Optional;

public enum Criterion {
    RELIABILITY("reliability", "Reliability"),
    COST_OF_USE("cost_of_use", "Cost of use"),
    COMFORT("comfort", "Comfort"),
    SAFETY("safety", "Safety"),
    PERFORMANCE("performance", "Performance"),
    RESIDUAL_VALUE("residual_value", "Residual value"),
    // weight-table only: scored as the mean of cost of use and performance
    AUTONOMY("autonomy", "Autonomy");

    private final String key;
    private final String label;

    Criterion(String key, String label) {
        this.key = key;
        this.label = label;
    }

    @JsonValue
    public String key() {
        return key;
    }

    public String label() {
        return label;
    }

    public boolean isVirtual() {
        return this == AUTONOMY;
    }

    public static Optional<Criterion> fromKey(String raw) {
        if (raw == null) {
            return Optional.empty();
        }
        String normalized = raw.trim().toLowerCase(Locale.ROOT).replace('-', '_').replace(' ', '_');
        for (Criterion criterion : values()) {
            if (criterion.key.equals(normalized)) {
                return Optional.of(criterion);
            }
        }
        return Optional.empty();
    }
}
