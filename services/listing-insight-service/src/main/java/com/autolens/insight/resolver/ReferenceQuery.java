package com.autolens.insight.resolver;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Projection onto the government car-labelling dataset, which encodes power in kW and fuel with its
 * own multi-letter codes.
 */
public record ReferenceQuery(
    @JsonProperty("brand") String brand,
    @JsonProperty("power_kw_range") IntRange powerKwRange,
    @JsonProperty("fuel_codes") List<String> fuelCodes,
    @JsonIgnore VehicleFeatures features
) {
    public static final String SOURCE = "ademe_car_labelling";
    public static final double HP_TO_KW = 0.7355;
    public static final int POWER_TOLERANCE_KW = 8;

    private static final Map<FuelType, List<String>> FUEL_CODES = fuelCodeTable();

    public ReferenceQuery {
        fuelCodes = fuelCodes == null ? null : List.copyOf(fuelCodes);
    }

    @JsonProperty("source")
    public String source() {
        return SOURCE;
    }

    public static int toKilowatts(int powerHp) {
        return (int) (powerHp * HP_TO_KW);
    }

    public static List<String> fuelCodesFor(FuelType fuel) {
        if (fuel == null) {
            return List.of();
        }
        return FUEL_CODES.getOrDefault(fuel, List.of());
    }

    public Map<String, Object> toFilterMap() {
        Map<String, Object> filters = new LinkedHashMap<>();
        if (brand != null) {
            filters.put("brand", brand);
        }
        if (powerKwRange != null) {
            filters.put("power_kw_range", powerKwRange.toMap());
        }
        if (fuelCodes != null) {
            filters.put("fuel_codes", fuelCodes);
        }
        return filters;
    }

    private static Map<FuelType, List<String>> fuelCodeTable() {
        Map<FuelType, List<String>> codes = new EnumMap<>(FuelType.class);
        codes.put(FuelType.PETROL, List.of("ES", "ES/GN", "ES/GP"));
        codes.put(FuelType.DIESEL, List.of("GO", "GO/GN"));
        codes.put(FuelType.HYBRID, List.of("EH", "GH"));
        codes.put(FuelType.PLUG_IN_HYBRID, List.of("EE", "GE", "GL", "EL"));
        codes.put(FuelType.ELECTRIC, List.of("EL"));
        codes.put(FuelType.LPG, List.of("GP", "ES/GP"));
        codes.put(FuelType.CNG, List.of("GN", "ES/GN"));
        return codes;
    }
}
