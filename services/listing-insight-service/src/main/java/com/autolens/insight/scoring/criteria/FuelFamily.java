package com.autolens.insight.scoring.criteria;

import java.util.List;

/** Consumption reference bands; electric figures are kWh/100km, the others L/100km. */
public enum FuelFamily {
    PETROL(5.0, 7.0, 9.0, "L"),
    DIESEL(4.5, 6.0, 8.0, "L"),
    HYBRID(4.0, 5.5, 7.0, "L"),
    ELECTRIC(14.0, 17.0, 22.0, "kWh");

    private static final List<String> ELECTRIC_MODELS = List.of("model 3", "model s", "model y", "e-");

    private final double excellent;
    private final double average;
    private final double poor;
    private final String unit;

    FuelFamily(double excellent, double average, double poor, String unit) {
        this.excellent = excellent;
        this.average = average;
        this.poor = poor;
        this.unit = unit;
    }

    public double excellent() {
        return excellent;
    }

    public double average() {
        return average;
    }

    public double poor() {
        return poor;
    }

    public String unit() {
        return unit;
    }

    /** The model name also counts: an {@code e-208} labelled "essence" is still electric. */
    public static FuelFamily detect(String fuelLabel, String model) {
        String fuel = KeywordMatcher.fold(fuelLabel == null ? "" : fuelLabel);
        String modelName = KeywordMatcher.fold(model == null ? "" : model);
        if (fuel.contains("electr") || fuel.contains("ev") || containsAny(modelName, ELECTRIC_MODELS)) {
            return ELECTRIC;
        }
        if (fuel.contains("hybride") || fuel.contains("hybrid")) {
            return HYBRID;
        }
        if (fuel.contains("diesel") || fuel.contains("hdi") || fuel.contains("tdi")) {
            return DIESEL;
        }
        return PETROL;
    }

    private static boolean containsAny(String text, List<String> needles) {
        for (String needle : needles) {
            if (text.contains(needle)) {
                return true;
            }
        }
        return false;
    }
}
