package com.autolens.insight.market;

import java.util.Map;

public final class MarketTablesValidator {
    private MarketTablesValidator() {}

    public static void validate(MarketTables tables, double weightTolerance) {
        if (tables == null) {
            throw new IllegalStateException("market tables missing");
        }
        if (tables.getBrands().isEmpty()) {
            throw new IllegalStateException("brands table empty");
        }
        if (tables.weights(MarketSegment.VOLUME).isEmpty()) {
            throw new IllegalStateException("segment_weights.Volume required");
        }

        for (Map.Entry<MarketSegment, SegmentWeights> entry : tables.getSegmentWeights().entrySet()) {
            String segment = entry.getKey().key();
            SegmentWeights weights = entry.getValue();
            for (Map.Entry<Criterion, Double> weight : weights.asMap().entrySet()) {
                double value = weight.getValue();
                if (Double.isNaN(value) || value < 0.0 || value > 1.0) {
                    throw new IllegalStateException(
                        "weight out of [0,1] for " + segment + "." + weight.getKey().key() + ": " + value
                    );
                }
            }
            double sum = weights.sum();
            if (Math.abs(sum - 1.0) > weightTolerance) {
                throw new IllegalStateException(
                    String.format("weights for %s sum to %.3f, expected 1.0", segment, sum)
                );
            }
        }

        for (BrandProfile profile : tables.getBrands().values()) {
            if (profile.segmentLabel() == null || profile.segmentLabel().isBlank()) {
                throw new IllegalStateException("market_segment required: " + profile.key());
            }
        }

        for (Map.Entry<String, String> alias : tables.getSegmentAliases().entrySet()) {
            if (MarketSegment.fromKey(alias.getValue()).isEmpty()) {
                throw new IllegalStateException(
                    "segment alias " + alias.getKey() + " targets unknown segment " + alias.getValue()
                );
            }
        }
    }
}
