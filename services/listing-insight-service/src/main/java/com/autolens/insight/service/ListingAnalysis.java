package com.autolens.insight.service;

import com.autolens.insight.deal.DealAssessment;
import com.autolens.insight.deal.RecallReliability;
import com.autolens.insight.resolver.CatalogQuery;
import com.autolens.insight.resolver.ReferenceQuery;
import com.autolens.insight.resolver.VehicleFeatures;
import com.autolens.insight.scoring.VehicleScoreOutput;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record ListingAnalysis(
    @JsonProperty("brand") String brand,
    @JsonProperty("model") String model,
    @JsonProperty("features") VehicleFeatures features,
    @JsonProperty("catalog_query") CatalogQuery catalogQuery,
    @JsonProperty("reference_query") ReferenceQuery referenceQuery,
    @JsonProperty("score") VehicleScoreOutput score,
    @JsonProperty("deal") DealAssessment deal,
    @JsonProperty("recall_reliability") RecallReliability recallReliability
) {}
