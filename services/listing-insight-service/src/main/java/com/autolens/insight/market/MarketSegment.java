package com.autolens.insight.market;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;
import java.util.Optional;

public enum MarketSegment {
    BUDGET("Budget"),
    VOLUME("Volume"),
    PREMIUM("Premium"),
    LUXURY_SPORT("Luxury_Sport"),
    SUV_SPECIALIST("SUV_Specialist"),
    ELECTRIC_FIRST("Electric_First");

    private final String key;

    MarketSegment(String key) {
        this.key = key;
    }

    @JsonValue
    public String key() {
        return key;
    }

    /** Matches {@code "Luxury Sport"}, {@code "luxury_sport"} or {@code "LUXURY_SPORT"}; aliases are not consulted. */
    public static Optional<MarketSegment> fromKey(String raw) {
        if (raw == null) {
            return Optional.empty();
        }
        String normalized = raw.trim().replace(' ', '_').replace('+', '_').toLowerCase(Locale.ROOT);
        for (MarketSegment segment : values()) {
            if (segment.key.toLowerCase(Locale.ROOT).equals(normalized)) {
                return Optional.of(segment);
            }
        }
        return Optional.empty();
    }
}
