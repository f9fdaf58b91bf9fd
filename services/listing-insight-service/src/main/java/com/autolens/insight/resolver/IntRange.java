package com.autolens.insight.resolver;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.LinkedHashMap;
import java.util.Map;

public record IntRange(@JsonProperty("min") int min, @JsonProperty("max") int max) {

    public static IntRange around(int center, int tolerance) {
        return new IntRange(center - tolerance, center + tolerance);
    }

    public boolean contains(int value) {
        return value >= min && value <= max;
    }

    Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("min", min);
        map.put("max", max);
        return map;
    }
}
