package com.autolens.insight.market;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "insight.market-tables")
public class MarketTablesProperties {
    private String path = "classpath:config/market-tables.yaml";
    private boolean strict = true;
    private double weightTolerance = 0.01;

    public String getPath() {
        return path;
    }

    public void setPath(String path) {
        this.path = path;
    }

    public boolean isStrict() {
        return strict;
    }

    public void setStrict(boolean strict) {
        this.strict = strict;
    }

    public double getWeightTolerance() {
        return weightTolerance;
    }

    public void setWeightTolerance(double weightTolerance) {
        this.weightTolerance = weightTolerance;
    }
}
