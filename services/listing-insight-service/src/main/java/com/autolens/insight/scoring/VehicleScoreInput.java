package com.autolens.insight.scoring;

import java.util.List;

/**
 * Scoring input. Every enrichment field is optional; zero or empty means "not known" and leads the
 * calculators down their neutral path.
 */
public final class VehicleScoreInput {
    public static final String DEFAULT_FUEL_LABEL = "essence";

    private final String brand;
    private final String model;
    private final Integer year;
    private final double price;
    private final int mileage;
    private final String fuelLabel;
    private final double reliabilityScore;
    private final int reviewCount;
    private final List<String> knownIssues;
    private final List<String> pros;
    private final List<String> cons;
    private final int co2;
    private final double consumption;
    private final int powerHp;
    private final double newPrice;
    private final double currentValue;

    private VehicleScoreInput(Builder builder) {
        this.brand = builder.brand == null ? "" : builder.brand;
        this.model = builder.model == null ? "" : builder.model;
        this.year = builder.year;
        this.price = builder.price;
        this.mileage = builder.mileage;
        this.fuelLabel = builder.fuelLabel == null || builder.fuelLabel.isBlank()
            ? DEFAULT_FUEL_LABEL
            : builder.fuelLabel;
        this.reliabilityScore = builder.reliabilityScore;
        this.reviewCount = builder.reviewCount;
        this.knownIssues = copy(builder.knownIssues);
        this.pros = copy(builder.pros);
        this.cons = copy(builder.cons);
        this.co2 = builder.co2;
        this.consumption = builder.consumption;
        this.powerHp = builder.powerHp;
        this.newPrice = builder.newPrice;
        this.currentValue = builder.currentValue;
    }

    public static Builder builder(String brand, String model) {
        return new Builder().brand(brand).model(model);
    }

    public String getBrand() {
        return brand;
    }

    public String getModel() {
        return model;
    }

    public Integer getYear() {
        return year;
    }

    public double getPrice() {
        return price;
    }

    public int getMileage() {
        return mileage;
    }

    public String getFuelLabel() {
        return fuelLabel;
    }

    public double getReliabilityScore() {
        return reliabilityScore;
    }

    public int getReviewCount() {
        return reviewCount;
    }

    public List<String> getKnownIssues() {
        return knownIssues;
    }

    public List<String> getPros() {
        return pros;
    }

    public List<String> getCons() {
        return cons;
    }

    public int getCo2() {
        return co2;
    }

    public double getConsumption() {
        return consumption;
    }

    public int getPowerHp() {
        return powerHp;
    }

    public double getNewPrice() {
        return newPrice;
    }

    public double getCurrentValue() {
        return currentValue;
    }

    private static List<String> copy(List<String> values) {
        if (values == null || values.isEmpty()) {
            return List.of();
        }
        return values.stream().filter(value -> value != null && !value.isBlank()).toList();
    }

    public static final class Builder {
        private String brand;
        private String model;
        private Integer year;
        private double price;
        private int mileage;
        private String fuelLabel;
        private double reliabilityScore;
        private int reviewCount;
        private List<String> knownIssues;
        private List<String> pros;
        private List<String> cons;
        private int co2;
        private double consumption;
        private int powerHp;
        private double newPrice;
        private double currentValue;

        private Builder() {
        }

        public Builder brand(String brand) {
            this.brand = brand;
            return this;
        }

        public Builder model(String model) {
            this.model = model;
            return this;
        }

        public Builder year(Integer year) {
            this.year = year;
            return this;
        }

        public Builder price(double price) {
            this.price = price;
            return this;
        }

        public Builder mileage(int mileage) {
            this.mileage = mileage;
            return this;
        }

        public Builder fuelLabel(String fuelLabel) {
            this.fuelLabel = fuelLabel;
            return this;
        }

        public Builder reliabilityScore(double reliabilityScore) {
            this.reliabilityScore = reliabilityScore;
            return this;
        }

        public Builder reviewCount(int reviewCount) {
            this.reviewCount = reviewCount;
            return this;
        }

        public Builder knownIssues(List<String> knownIssues) {
            this.knownIssues = knownIssues;
            return this;
        }

        public Builder pros(List<String> pros) {
            this.pros = pros;
            return this;
        }

        public Builder cons(List<String> cons) {
            this.cons = cons;
            return this;
        }

        public Builder co2(int co2) {
            this.co2 = co2;
            return this;
        }

        public Builder consumption(double consumption) {
            this.consumption = consumption;
            return this;
        }

        public Builder powerHp(int powerHp) {
            this.powerHp = powerHp;
            return this;
        }

        public Builder newPrice(double newPrice) {
            this.newPrice = newPrice;
            return this;
        }

        public Builder currentValue(double currentValue) {
            this.currentValue = currentValue;
            return this;
        }

        public VehicleScoreInput build() {
            return new VehicleScoreInput(this);
        }
    }
}
