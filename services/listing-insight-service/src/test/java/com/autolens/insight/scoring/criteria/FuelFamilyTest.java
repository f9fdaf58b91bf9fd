package com.autolens.insight.scoring.criteria;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class FuelFamilyTest {

    @Test
    void detectsFromLabelThenModel() {
        assertThat(FuelFamily.detect("électrique", "Zoe")).isEqualTo(FuelFamily.ELECTRIC);
        assertThat(FuelFamily.detect("essence", "Model 3")).isEqualTo(FuelFamily.ELECTRIC);
        assertThat(FuelFamily.detect("hybride", "Yaris")).isEqualTo(FuelFamily.HYBRID);
        assertThat(FuelFamily.detect("BlueHDi", "308")).isEqualTo(FuelFamily.DIESEL);
        assertThat(FuelFamily.detect(null, null)).isEqualTo(FuelFamily.PETROL);
    }
}
