package com.autolens.insight.resolver;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.LinkedHashMap;
import java.util.Map;

public record VehicleFeatures(
    @JsonProperty("power_hp") Integer powerHp,
    @JsonProperty("year") Integer year,
    @JsonProperty("gearbox") GearboxType gearbox,
    @JsonProperty("fuel") FuelType fuel,
    @JsonIgnore String rawText
) {
    public static final int MIN_POWER = 50;
    public static final int MAX_POWER = 800;
    public static final int MIN_YEAR = 2000;
    public static final int MAX_YEAR = 2026;

    public VehicleFeatures {
        if (powerHp != null && !isValidPower(powerHp)) {
            throw new IllegalArgumentException("power_hp out of range: " + powerHp);
        }
        if (year != null && !isValidYear(year)) {
            throw new IllegalArgumentException("year out of range: " + year);
        }
        gearbox = gearbox == null ? GearboxType.UNKNOWN : gearbox;
        fuel = fuel == null ? FuelType.UNKNOWN : fuel;
        rawText = rawText == null ? "" : rawText;
    }

    @JsonIgnore
    public boolean isComplete() {
        return powerHp != null
            && year != null
            && gearbox != GearboxType.UNKNOWN
            && fuel != FuelType.UNKNOWN;
    }

    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("power_hp", powerHp);
        map.put("year", year);
        map.put("gearbox", gearbox.code());
        map.put("fuel", fuel.code());
        return map;
    }

    public static boolean isValidPower(Integer power) {
        return power != null && power >= MIN_POWER && power <= MAX_POWER;
    }

    public static boolean isValidYear(Integer year) {
        return year != null && year >= MIN_YEAR && year <= MAX_YEAR;
    }
}
