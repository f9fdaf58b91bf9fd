package com.autolens.insight.resolver;

import com.fasterxml.jackson.annotation.JsonValue;

public enum FuelType {
    PETROL("essence"),
    DIESEL("diesel"),
    HYBRID("hybride"),
    PLUG_IN_HYBRID("hybride_rechargeable"),
    ELECTRIC("electrique"),
    LPG("gpl"),
    CNG("gnv"),
    UNKNOWN("inconnu");

    private final String code;

    FuelType(String code) {
        this.code = code;
    }

    @JsonValue
    public String code() {
        return code;
    }
}
