package com.autolens.insight.scoring;

import com.autolens.insight.market.Criterion;
import com.autolens.insight.market.MarketSegment;
import com.autolens.insight.market.VehicleCategory;
import com.fasterxml.jackson.annotation.JsonAutoDetect;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

// only the explicitly named properties are serialized; typed getters stay internal
@JsonAutoDetect(getterVisibility = JsonAutoDetect.Visibility.NONE, isGetterVisibility = JsonAutoDetect.Visibility.NONE)
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class VehicleScoreOutput {
    private final double scoreGlobal;
    private final Map<Criterion, Double> scores;
    private final MarketSegment segment;
    private final VehicleCategory category;
    private final double confidence;
    private final List<String> strengths;
    private final List<String> weaknesses;
    private final String verdict;
    private final Map<Criterion, List<String>> details;
    private final Map<Criterion, Double> weights;
    private final String segmentFallbackStage;

    public VehicleScoreOutput(
        double scoreGlobal,
        Map<Criterion, Double> scores,
        MarketSegment segment,
        VehicleCategory category,
        double confidence,
        List<String> strengths,
        List<String> weaknesses,
        String verdict,
        Map<Criterion, List<String>> details,
        Map<Criterion, Double> weights
    ) {
        this(scoreGlobal, scores, segment, category, confidence, strengths, weaknesses, verdict, details, weights, null);
    }

    public VehicleScoreOutput(
        double scoreGlobal,
        Map<Criterion, Double> scores,
        MarketSegment segment,
        VehicleCategory category,
        double confidence,
        List<String> strengths,
        List<String> weaknesses,
        String verdict,
        Map<Criterion, List<String>> details,
        Map<Criterion, Double> weights,
        String segmentFallbackStage
    ) {
        this.scoreGlobal = scoreGlobal;
        this.scores = immutableEnumMap(scores);
        this.segment = segment;
        this.category = category;
        this.confidence = confidence;
        this.strengths = strengths == null ? List.of() : List.copyOf(strengths);
        this.weaknesses = weaknesses == null ? List.of() : List.copyOf(weaknesses);
        this.verdict = verdict;
        Map<Criterion, List<String>> detailCopy = new EnumMap<>(Criterion.class);
        if (details != null) {
            details.forEach((criterion, lines) -> detailCopy.put(criterion, List.copyOf(lines)));
        }
        this.details = Collections.unmodifiableMap(detailCopy);
        this.weights = immutableEnumMap(weights);
        this.segmentFallbackStage = segmentFallbackStage;
    }

    @JsonProperty("score_global")
    public double getScoreGlobal() {
        return scoreGlobal;
    }

    @JsonProperty("scores")
    public Map<String, Double> getScoresByKey() {
        Map<String, Double> byKey = new LinkedHashMap<>();
        scores.forEach((criterion, value) -> byKey.put(criterion.key(), value));
        return byKey;
    }

    public Map<Criterion, Double> getScores() {
        return scores;
    }

    public double getScore(Criterion criterion) {
        return scores.getOrDefault(criterion, 0.0);
    }

    public double getReliability() {
        return getScore(Criterion.RELIABILITY);
    }

    public double getCostOfUse() {
        return getScore(Criterion.COST_OF_USE);
    }

    public double getComfort() {
        return getScore(Criterion.COMFORT);
    }

    public double getSafety() {
        return getScore(Criterion.SAFETY);
    }

    public double getPerformance() {
        return getScore(Criterion.PERFORMANCE);
    }

    public double getResidualValue() {
        return getScore(Criterion.RESIDUAL_VALUE);
    }

    @JsonProperty("segment")
    public MarketSegment getSegment() {
        return segment;
    }

    @JsonProperty("category")
    public VehicleCategory getCategory() {
        return category;
    }

    @JsonProperty("confidence")
    public double getConfidence() {
        return confidence;
    }

    @JsonProperty("strengths")
    public List<String> getStrengths() {
        return strengths;
    }

    @JsonProperty("weaknesses")
    public List<String> getWeaknesses() {
        return weaknesses;
    }

    @JsonProperty("verdict")
    public String getVerdict() {
        return verdict;
    }

    public Map<Criterion, List<String>> getDetails() {
        return details;
    }

    public Map<Criterion, Double> getWeights() {
        return weights;
    }

    /**
     * Fallback stage the segment was resolved through, taken from the same table snapshot as the score.
     */
    public Optional<String> getSegmentFallbackStage() {
        return Optional.ofNullable(segmentFallbackStage);
    }

    @JsonProperty("details")
    public Map<String, List<String>> getDetailsByKey() {
        Map<String, List<String>> byKey = new LinkedHashMap<>();
        details.forEach((criterion, lines) -> byKey.put(criterion.key(), lines));
        return byKey;
    }

    @JsonProperty("weights")
    public Map<String, Double> getWeightsByKey() {
        Map<String, Double> byKey = new LinkedHashMap<>();
        weights.forEach((criterion, weight) -> byKey.put(criterion.key(), weight));
        return byKey;
    }

    private static Map<Criterion, Double> immutableEnumMap(Map<Criterion, Double> source) {
        Map<Criterion, Double> copy = new EnumMap<>(Criterion.class);
        if (source != null) {
            copy.putAll(source);
        }
        return Collections.unmodifiableMap(copy);
    }
}
