package com.autolens.insight.scoring.criteria;

import static org.assertj.core.api.Assertions.assertThat;

import com.autolens.insight.market.MarketSegment;
import com.autolens.insight.scoring.VehicleScoreInput;
import java.util.List;
import org.junit.jupiter.api.Test;

class PerformanceCalculatorTest {

    private final PerformanceCalculator calculator = new PerformanceCalculator();

    @Test
    void powerIsJudgedAgainstSegment() {
        VehicleScoreInput input = VehicleScoreInput.builder("Dacia", "Duster").powerHp(130).build();

        assertThat(calculator.score(input, MarketSegment.BUDGET).value()).isEqualTo(7.0);
        assertThat(calculator.score(input, MarketSegment.VOLUME).value()).isEqualTo(6.0);
        assertThat(calculator.score(input, MarketSegment.PREMIUM).value()).isEqualTo(5.0);
        assertThat(calculator.score(input, MarketSegment.LUXURY_SPORT).value()).isEqualTo(4.0);
    }

    @Test
    void suvSpecialistUsesDefaultThresholds() {
        assertThat(PerformanceCalculator.thresholdsFor(MarketSegment.SUV_SPECIALIST))
            .isEqualTo(new PerformanceCalculator.PowerThresholds(130, 180));
        assertThat(PerformanceCalculator.thresholdsFor(null).excellent()).isEqualTo(180);
    }

    @Test
    void dynamicProsAreCapped() {
        VehicleScoreInput input = VehicleScoreInput.builder("Mazda", "MX-5")
            .pros(List.of("Très dynamique", "Agile", "Tenue de route", "Direction précise", "Freins endurants"))
            .build();

        assertThat(calculator.score(input, MarketSegment.VOLUME).value()).isEqualTo(6.5);
    }
}
