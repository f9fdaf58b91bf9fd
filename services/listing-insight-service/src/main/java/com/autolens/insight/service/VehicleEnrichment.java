package com.autolens.insight.service;

import com.autolens.insight.deal.RecallNotice;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

/** Model-level data gathered from reviews, recall registries and price guides. Every field is optional. */
@JsonIgnoreProperties(ignoreUnknown = true)
public class VehicleEnrichment {
    @JsonProperty("reliability_score")
    private Double reliabilityScore;

    @JsonProperty("review_count")
    private Integer reviewCount;

    @JsonProperty("known_issues")
    private List<String> knownIssues;

    private List<String> pros;
    private List<String> cons;
    private Double consumption;
    private Integer co2;

    @JsonProperty("new_price")
    private Double newPrice;

    @JsonProperty("current_value")
    private Double currentValue;

    @JsonProperty("recall_count")
    private Integer recallCount;

    private List<RecallNotice> recalls;

    @JsonProperty("reliability_alerts")
    private List<String> reliabilityAlerts;

    public Double getReliabilityScore() {
        return reliabilityScore;
    }

    public void setReliabilityScore(Double reliabilityScore) {
        this.reliabilityScore = reliabilityScore;
    }

    public Integer getReviewCount() {
        return reviewCount;
    }

    public void setReviewCount(Integer reviewCount) {
        this.reviewCount = reviewCount;
    }

    public List<String> getKnownIssues() {
        return knownIssues;
    }

    public void setKnownIssues(List<String> knownIssues) {
        this.knownIssues = knownIssues;
    }

    public List<String> getPros() {
        return pros;
    }

    public void setPros(List<String> pros) {
        this.pros = pros;
    }

    public List<String> getCons() {
        return cons;
    }

    public void setCons(List<String> cons) {
        this.cons = cons;
    }

    public Double getConsumption() {
        return consumption;
    }

    public void setConsumption(Double consumption) {
        this.consumption = consumption;
    }

    public Integer getCo2() {
        return co2;
    }

    public void setCo2(Integer co2) {
        this.co2 = co2;
    }

    public Double getNewPrice() {
        return newPrice;
    }

    public void setNewPrice(Double newPrice) {
        this.newPrice = newPrice;
    }

    public Double getCurrentValue() {
        return currentValue;
    }

    public void setCurrentValue(Double currentValue) {
        this.currentValue = currentValue;
    }

    /** Count reported by the recall registry; may be larger than the notices listed. */
    public Integer getRecallCount() {
        return recallCount;
    }

    public void setRecallCount(Integer recallCount) {
        this.recallCount = recallCount;
    }

    public List<RecallNotice> getRecalls() {
        return recalls;
    }

    public void setRecalls(List<RecallNotice> recalls) {
        this.recalls = recalls;
    }

    public List<String> getReliabilityAlerts() {
        return reliabilityAlerts;
    }

    public void setReliabilityAlerts(List<String> reliabilityAlerts) {
        this.reliabilityAlerts = reliabilityAlerts;
    }
}
