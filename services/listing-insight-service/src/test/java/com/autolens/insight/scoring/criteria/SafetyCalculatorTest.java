package com.autolens.insight.scoring.criteria;

import static org.assertj.core.api.Assertions.assertThat;

import com.autolens.insight.market.MarketSegment;
import com.autolens.insight.scoring.VehicleScoreInput;
import java.util.List;
import org.junit.jupiter.api.Test;

class SafetyCalculatorTest {

    private final SafetyCalculator calculator = new SafetyCalculator();

    @Test
    void newerYearsScoreHigher() {
        assertThat(score(2023)).isEqualTo(7.0);
        assertThat(score(2020)).isEqualTo(6.0);
        assertThat(score(2017)).isEqualTo(5.0);
        assertThat(score(2012)).isEqualTo(4.0);
        assertThat(score(null)).isEqualTo(5.0);
    }

    @Test
    void safetyEquipmentInPros() {
        VehicleScoreInput input = VehicleScoreInput.builder("Volvo", "XC40")
            .year(2018)
            .pros(List.of("5 étoiles Euro NCAP", "Aides à la conduite", "Freinage d'urgence automatique", "Sécurité"))
            .build();

        assertThat(calculator.score(input, MarketSegment.PREMIUM).value()).isEqualTo(6.5);
    }

    private double score(Integer year) {
        return calculator.score(VehicleScoreInput.builder("Renault", "Clio").year(year).build(), MarketSegment.VOLUME).value();
    }
}
