package com.autolens.insight.scoring;

import java.util.List;

public record SubScore(double value, List<String> details) {
    public static final double MIN = 0.0;
    public static final double MAX = 10.0;
    public static final double NEUTRAL = 5.0;

    public SubScore {
        value = Math.max(MIN, Math.min(MAX, value));
        details = details == null ? List.of() : List.copyOf(details);
    }
}
