package com.autolens.insight.market;

import com.fasterxml.jackson.annotation.JsonValue;

public enum VehicleCategory {
    A("A", "City car"),
    B("B", "Supermini"),
    B_SUV("B-SUV", "Small SUV"),
    C("C", "Compact"),
    C_SUV("C-SUV", "Compact SUV"),
    D("D", "Large family car"),
    D_SUV("D-SUV", "Large SUV"),
    E("E", "Executive car"),
    F("F", "Luxury car"),
    MPV("MPV", "People carrier"),
    LCV("LCV", "Light commercial vehicle"),
    UNKNOWN("Unknown", "Unknown");

    private final String code;
    private final String label;

    VehicleCategory(String code, String label) {
        this.code = code;
        this.label = label;
    }

    @JsonValue
    public String code() {
        return code;
    }

    public String label() {
        return label;
    }
}
