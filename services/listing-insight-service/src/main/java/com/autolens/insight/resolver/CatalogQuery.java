package com.autolens.insight.resolver;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Projection of the extracted features onto the internal vehicle catalog. Absent fields are null and
 * are left out of {@link #toFilterMap()}.
 */
public record CatalogQuery(
    @JsonProperty("brand") String brand,
    @JsonProperty("model") String model,
    @JsonProperty("power_range") IntRange powerRange,
    @JsonProperty("fuel") FuelType fuel,
    @JsonProperty("gearbox") GearboxType gearbox,
    @JsonProperty("year_range") YearWindow yearRange,
    @JsonProperty("confidence_details") Map<String, Double> confidenceDetails,
    @JsonProperty("confidence") double confidence,
    @JsonIgnore VehicleFeatures features
) {
    public static final int POWER_TOLERANCE_HP = 10;
    public static final int YEAR_TOLERANCE = 1;

    public CatalogQuery {
        confidenceDetails = confidenceDetails == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(confidenceDetails));
    }

    @JsonProperty("query_completeness")
    public String completeness() {
        return features != null && features.isComplete() ? "full" : "partial";
    }

    public Map<String, Object> toFilterMap() {
        Map<String, Object> filters = new LinkedHashMap<>();
        if (brand != null) {
            filters.put("brand", brand);
        }
        if (model != null) {
            filters.put("model", model);
        }
        if (powerRange != null) {
            filters.put("power_range", powerRange.toMap());
        }
        if (fuel != null) {
            filters.put("fuel", fuel.code());
        }
        if (gearbox != null) {
            filters.put("gearbox", gearbox.code());
        }
        if (yearRange != null) {
            filters.put("year_range", yearRange.toMap());
        }
        return filters;
    }
}
