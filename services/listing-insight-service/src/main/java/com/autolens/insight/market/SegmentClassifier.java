package com.autolens.insight.market;

import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Brand to segment and segment to weights resolution over one {@link MarketTables} snapshot.
 * Fallback order: brand table, then the segment brand lists, then {@code Volume}; segment labels are
 * canonicalized by key, then by alias, then default to {@code Volume}.
 */
public final class SegmentClassifier {
    private static final Logger log = LoggerFactory.getLogger(SegmentClassifier.class);

    public static final String STAGE_BRAND_TABLE = "brand_table";
    public static final String STAGE_SEGMENT_MAPPING = "segment_mapping";
    public static final String STAGE_SEGMENT_KEY = "segment_key";
    public static final String STAGE_SEGMENT_ALIAS = "segment_alias";
    public static final String STAGE_SEGMENT_WEIGHTS = "segment_weights";
    public static final String STAGE_VOLUME_WEIGHTS = "volume_weights";

    private final MarketTables tables;
    private final LayeredLookup<String, String> brandLookup;
    private final LayeredLookup<String, MarketSegment> labelLookup;
    private final LayeredLookup<MarketSegment, SegmentWeights> weightLookup;

    public SegmentClassifier(MarketTables tables) {
        this.tables = tables;
        this.brandLookup = LayeredLookup.<String, String>builder()
            .stage(STAGE_BRAND_TABLE, brand -> tables.brand(brand).map(BrandProfile::segmentLabel))
            .stage(STAGE_SEGMENT_MAPPING, tables::segmentListing)
            .orElse(MarketSegment.VOLUME.key());
        this.labelLookup = LayeredLookup.<String, MarketSegment>builder()
            .stage(STAGE_SEGMENT_KEY, MarketSegment::fromKey)
            .stage(STAGE_SEGMENT_ALIAS, label -> tables.alias(label).flatMap(MarketSegment::fromKey))
            .orElse(MarketSegment.VOLUME);
        this.weightLookup = LayeredLookup.<MarketSegment, SegmentWeights>builder()
            .stage(STAGE_SEGMENT_WEIGHTS, tables::weights)
            .stage(STAGE_VOLUME_WEIGHTS, segment -> tables.weights(MarketSegment.VOLUME))
            .orElse(SegmentWeights.empty());
    }

    public MarketTables getTables() {
        return tables;
    }

    public SegmentResolution classify(String brand) {
        LayeredLookup.Resolution<String> label = brandLookup.resolve(isBlank(brand) ? null : brand);
        LayeredLookup.Resolution<MarketSegment> segment = labelLookup.resolve(label.value());
        if (label.isDefault() || segment.isDefault()) {
            log.debug("segment fallback brand={} label={} label_stage={} segment_stage={}",
                brand, label.value(), label.stage(), segment.stage());
        }
        return new SegmentResolution(segment.value(), label.value(), label.stage(), segment.stage());
    }

    public MarketSegment canonicalize(String segmentLabel) {
        return labelLookup.resolve(segmentLabel).value();
    }

    public LayeredLookup.Resolution<SegmentWeights> weightsFor(MarketSegment segment) {
        return weightLookup.resolve(segment);
    }

    private static boolean isBlank(String value) {
        return value == null || value.trim().isEmpty();
    }

    public record SegmentResolution(
        MarketSegment segment,
        String label,
        String brandStage,
        String segmentStage
    ) {
        public Optional<String> fallbackStage() {
            if (LayeredLookup.DEFAULT_STAGE.equals(brandStage)) {
                return Optional.of("brand_" + LayeredLookup.DEFAULT_STAGE);
            }
            if (STAGE_SEGMENT_MAPPING.equals(brandStage)) {
                return Optional.of(STAGE_SEGMENT_MAPPING);
            }
            if (LayeredLookup.DEFAULT_STAGE.equals(segmentStage)) {
                return Optional.of("segment_" + LayeredLookup.DEFAULT_STAGE);
            }
            return Optional.empty();
        }
    }
}
