package com.autolens.insight.scoring.criteria;

import static org.assertj.core.api.Assertions.assertThat;

import com.autolens.insight.market.MarketSegment;
import com.autolens.insight.scoring.VehicleScoreInput;
import java.util.List;
import org.junit.jupiter.api.Test;

class ComfortCalculatorTest {

    private final ComfortCalculator calculator = new ComfortCalculator();

    @Test
    void prosAndConsMoveComfort() {
        VehicleScoreInput input = VehicleScoreInput.builder("Citroen", "C5 Aircross")
            .pros(List.of("Très confortable", "Silencieux sur autoroute", "Grand coffre"))
            .cons(List.of("Suspension ferme à basse vitesse"))
            .build();

        assertThat(calculator.score(input, MarketSegment.VOLUME).value()).isEqualTo(5.5);
    }

    @Test
    void premiumSegmentRaisesTheBar() {
        VehicleScoreInput comfortable = VehicleScoreInput.builder("Audi", "A6")
            .pros(List.of("confort", "silence", "suspension pilotée", "espace à bord"))
            .build();
        VehicleScoreInput harsh = VehicleScoreInput.builder("Audi", "A3")
            .cons(List.of("inconfortable", "bruits d'air"))
            .build();

        assertThat(calculator.score(comfortable, MarketSegment.PREMIUM).value()).isEqualTo(8.0);
        assertThat(calculator.score(comfortable, MarketSegment.VOLUME).value()).isEqualTo(7.0);
        assertThat(calculator.score(harsh, MarketSegment.PREMIUM).value()).isEqualTo(4.0);
    }
}
