package com.autolens.insight.market;

import com.autolens.insight.resolver.TextNormalizer;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable snapshot of the brand, segment and weight tables. A reload builds a new instance; readers
 * holding the previous one keep a consistent view.
 */
public final class MarketTables {
    private final String version;
    private final Map<String, BrandProfile> brands;
    private final Map<String, List<String>> segmentMapping;
    private final Map<String, String> segmentAliases;
    private final Map<MarketSegment, SegmentWeights> segmentWeights;

    public MarketTables(
        String version,
        Map<String, BrandProfile> brands,
        Map<String, List<String>> segmentMapping,
        Map<String, String> segmentAliases,
        Map<MarketSegment, SegmentWeights> segmentWeights
    ) {
        this.version = version;
        this.brands = copyBrands(brands);
        this.segmentMapping = copyMapping(segmentMapping);
        this.segmentAliases = segmentAliases == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(segmentAliases));
        Map<MarketSegment, SegmentWeights> weights = new EnumMap<>(MarketSegment.class);
        if (segmentWeights != null) {
            weights.putAll(segmentWeights);
        }
        this.segmentWeights = Collections.unmodifiableMap(weights);
    }

    public static MarketTables empty(String version) {
        return new MarketTables(version, Map.of(), Map.of(), Map.of(), Map.of());
    }

    public String getVersion() {
        return version;
    }

    public Map<String, BrandProfile> getBrands() {
        return brands;
    }

    public Map<String, String> getSegmentAliases() {
        return segmentAliases;
    }

    public Map<MarketSegment, SegmentWeights> getSegmentWeights() {
        return segmentWeights;
    }

    public Optional<BrandProfile> brand(String brand) {
        return Optional.ofNullable(brands.get(TextNormalizer.tableKey(brand)));
    }

    /** Reverse lookup in the segment to brand lists. */
    public Optional<String> segmentListing(String brand) {
        String key = TextNormalizer.tableKey(brand);
        if (key.isEmpty()) {
            return Optional.empty();
        }
        for (Map.Entry<String, List<String>> entry : segmentMapping.entrySet()) {
            if (entry.getValue().contains(key)) {
                return Optional.of(entry.getKey());
            }
        }
        return Optional.empty();
    }

    public Optional<String> alias(String segmentLabel) {
        if (segmentLabel == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(segmentAliases.get(segmentLabel.trim()));
    }

    public Optional<SegmentWeights> weights(MarketSegment segment) {
        SegmentWeights weights = segmentWeights.get(segment);
        return weights == null || weights.isEmpty() ? Optional.empty() : Optional.of(weights);
    }

    private static Map<String, BrandProfile> copyBrands(Map<String, BrandProfile> brands) {
        Map<String, BrandProfile> copy = new LinkedHashMap<>();
        if (brands != null) {
            for (BrandProfile profile : brands.values()) {
                if (profile != null && profile.key() != null) {
                    copy.put(TextNormalizer.tableKey(profile.key()), profile);
                }
            }
        }
        return Collections.unmodifiableMap(copy);
    }

    private static Map<String, List<String>> copyMapping(Map<String, List<String>> mapping) {
        Map<String, List<String>> copy = new LinkedHashMap<>();
        if (mapping != null) {
            for (Map.Entry<String, List<String>> entry : mapping.entrySet()) {
                if (entry.getKey() == null || entry.getValue() == null) {
                    continue;
                }
                copy.put(entry.getKey(), entry.getValue().stream().map(TextNormalizer::tableKey).toList());
            }
        }
        return Collections.unmodifiableMap(copy);
    }
}
