package com.autolens.insight.resolver;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;

class VehicleFeaturesTest {

    @Test
    void rejectsOutOfRangeValues() {
        assertThatThrownBy(() -> new VehicleFeatures(900, null, null, null, null))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new VehicleFeatures(null, 1998, null, null, null))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void defaultsMissingEnumsToUnknown() {
        VehicleFeatures features = new VehicleFeatures(110, 2020, null, null, null);

        assertThat(features.gearbox()).isEqualTo(GearboxType.UNKNOWN);
        assertThat(features.fuel()).isEqualTo(FuelType.UNKNOWN);
        assertThat(features.isComplete()).isFalse();
        assertThat(features.toMap())
            .containsEntry("power_hp", 110)
            .containsEntry("gearbox", "inconnu")
            .containsEntry("fuel", "inconnu");
    }

    @Test
    void yearWindowAcceptsOpenEndedProduction() {
        YearWindow window = YearWindow.around(2019, CatalogQuery.YEAR_TOLERANCE);

        assertThat(window.matches(2016, null)).isTrue();
        assertThat(window.matches(2016, 2018)).isTrue();
        assertThat(window.matches(2010, 2017)).isFalse();
        assertThat(window.matches(2021, null)).isFalse();
    }

    @Test
    void intRangeIsInclusive() {
        IntRange range = IntRange.around(130, CatalogQuery.POWER_TOLERANCE_HP);

        assertThat(range.contains(120)).isTrue();
        assertThat(range.contains(140)).isTrue();
        assertThat(range.contains(141)).isFalse();
    }
}
