package com.autolens.insight.resolver;

import com.fasterxml.jackson.annotation.JsonValue;

public enum GearboxType {
    MANUAL("manuelle"),
    AUTOMATIC("automatique"),
    UNKNOWN("inconnu");

    private final String code;

    GearboxType(String code) {
        this.code = code;
    }

    @JsonValue
    public String code() {
        return code;
    }
}
