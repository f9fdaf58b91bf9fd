package com.autolens.insight.deal;

import com.fasterxml.jackson.annotation.JsonProperty;

public record DealAssessment(
    @JsonProperty("deal_score") double dealScore,
    @JsonProperty("is_good_deal") boolean goodDeal,
    @JsonProperty("expert_points") double expertPoints,
    @JsonProperty("mileage_points") int mileagePoints,
    @JsonProperty("price_points") int pricePoints,
    @JsonProperty("alert_points") int alertPoints
) {
    public static final double MIN_SCORE = -100.0;
    public static final double MAX_SCORE = 100.0;
}
