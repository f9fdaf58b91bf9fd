package com.autolens.insight.deal;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "insight.deal")
public class DealProperties {
    private double goodDealThreshold = 20.0;

    public double getGoodDealThreshold() {
        return goodDealThreshold;
    }

    public void setGoodDealThreshold(double goodDealThreshold) {
        this.goodDealThreshold = goodDealThreshold;
    }
}
