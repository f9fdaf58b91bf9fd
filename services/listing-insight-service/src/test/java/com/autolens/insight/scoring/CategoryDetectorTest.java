package com.autolens.insight.scoring;

import static org.assertj.core.api.Assertions.assertThat;

import com.autolens.insight.market.VehicleCategory;
import org.junit.jupiter.api.Test;

class CategoryDetectorTest {

    @Test
    void detectsCategoryByWholeWord() {
        assertThat(CategoryDetector.detect("Clio")).isEqualTo(VehicleCategory.B);
        assertThat(CategoryDetector.detect("3008")).isEqualTo(VehicleCategory.C_SUV);
        assertThat(CategoryDetector.detect("Captur")).isEqualTo(VehicleCategory.B_SUV);
        assertThat(CategoryDetector.detect("Model 3")).isEqualTo(VehicleCategory.D);
        assertThat(CategoryDetector.detect("Série 5 Touring")).isEqualTo(VehicleCategory.E);
        assertThat(CategoryDetector.detect("T-Cross")).isEqualTo(VehicleCategory.B_SUV);
    }

    @Test
    void numbersInsideLongerNamesDoNotMatch() {
        // "208" must not fire inside "2008"
        assertThat(CategoryDetector.detect("2008")).isEqualTo(VehicleCategory.B_SUV);
        assertThat(CategoryDetector.detect("Polonaise")).isEqualTo(VehicleCategory.UNKNOWN);
    }

    @Test
    void blankModelIsUnknown() {
        assertThat(CategoryDetector.detect(null)).isEqualTo(VehicleCategory.UNKNOWN);
        assertThat(CategoryDetector.detect(" ")).isEqualTo(VehicleCategory.UNKNOWN);
    }
}
