package com.autolens.insight.resolver;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Matches catalog rows whose production started no later than {@code productionStartMax} and that are
 * either still produced (no end year) or ended no earlier than {@code productionEndMin}.
 */
public record YearWindow(
    @JsonProperty("production_start_max") int productionStartMax,
    @JsonProperty("production_end_min") int productionEndMin
) {

    public static YearWindow around(int year, int tolerance) {
        return new YearWindow(year + tolerance, year - tolerance);
    }

    public boolean matches(int productionStart, Integer productionEnd) {
        if (productionStart > productionStartMax) {
            return false;
        }
        return productionEnd == null || productionEnd >= productionEndMin;
    }

    Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("production_start_max", productionStartMax);
        map.put("production_end_min", productionEndMin);
        return map;
    }
}
