package com.autolens.insight.market;

import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.EnumMap;
import java.util.Map;
import org.junit.jupiter.api.Test;

class MarketTablesValidatorTest {

    private static final Map<String, BrandProfile> BRANDS = Map.of("dacia", new BrandProfile("dacia", "Dacia", "Budget"));

    @Test
    void acceptsWeightsWithinTolerance() {
        MarketTables tables = tables(volume(0.5, 0.505), Map.of("Luxury", "Premium"));

        assertThatCode(() -> MarketTablesValidator.validate(tables, 0.01)).doesNotThrowAnyException();
    }

    @Test
    void rejectsWeightsNotSummingToOne() {
        MarketTables tables = tables(volume(0.5, 0.4), Map.of());

        assertThatThrownBy(() -> MarketTablesValidator.validate(tables, 0.01))
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("Volume");
    }

    @Test
    void rejectsWeightOutOfRange() {
        MarketTables tables = tables(volume(1.5, -0.5), Map.of());

        assertThatThrownBy(() -> MarketTablesValidator.validate(tables, 0.01))
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("out of [0,1]");
    }

    @Test
    void requiresVolumeWeights() {
        Map<MarketSegment, SegmentWeights> weights = new EnumMap<>(MarketSegment.class);
        weights.put(MarketSegment.BUDGET, new SegmentWeights(Map.of(Criterion.RELIABILITY, 1.0)));

        assertThatThrownBy(() -> MarketTablesValidator.validate(tables(weights, Map.of()), 0.01))
            .hasMessageContaining("Volume");
    }

    @Test
    void rejectsAliasToUnknownSegment() {
        MarketTables tables = tables(volume(0.5, 0.5), Map.of("Hyper", "Hypercar"));

        assertThatThrownBy(() -> MarketTablesValidator.validate(tables, 0.01))
            .hasMessageContaining("Hypercar");
    }

    @Test
    void rejectsEmptyBrands() {
        MarketTables tables = new MarketTables("mt_test", Map.of(), Map.of(), Map.of(), volume(0.5, 0.5));

        assertThatThrownBy(() -> MarketTablesValidator.validate(tables, 0.01))
            .hasMessageContaining("brands");
    }

    private static Map<MarketSegment, SegmentWeights> volume(double reliability, double comfort) {
        Map<MarketSegment, SegmentWeights> weights = new EnumMap<>(MarketSegment.class);
        weights.put(MarketSegment.VOLUME, new SegmentWeights(Map.of(
            Criterion.RELIABILITY, reliability,
            Criterion.COMFORT, comfort
        )));
        return weights;
    }

    private static MarketTables tables(Map<MarketSegment, SegmentWeights> weights, Map<String, String> aliases) {
        return new MarketTables("mt_test", BRANDS, Map.of(), aliases, weights);
    }
}
