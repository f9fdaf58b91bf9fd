package com.autolens.insight.scoring.criteria;

import static org.assertj.core.api.Assertions.assertThat;

import com.autolens.insight.market.MarketSegment;
import com.autolens.insight.scoring.VehicleScoreInput;
import org.junit.jupiter.api.Test;

class CostOfUseCalculatorTest {

    private final CostOfUseCalculator calculator = new CostOfUseCalculator();

    @Test
    void frugalCarEarnsMoreInVolumeSegments() {
        VehicleScoreInput input = VehicleScoreInput.builder("Renault", "Clio").consumption(4.8).build();

        assertThat(calculator.score(input, MarketSegment.VOLUME).value()).isEqualTo(8.0);
        assertThat(calculator.score(input, MarketSegment.PREMIUM).value()).isEqualTo(7.5);
    }

    @Test
    void consumptionBandsDependOnFuel() {
        VehicleScoreInput thirstyDiesel = VehicleScoreInput.builder("Peugeot", "5008")
            .fuelLabel("diesel")
            .consumption(8.5)
            .build();
        VehicleScoreInput midPetrol = VehicleScoreInput.builder("Peugeot", "308").consumption(8.0).build();
        VehicleScoreInput electric = VehicleScoreInput.builder("Peugeot", "e-208").consumption(15.0).build();

        assertThat(calculator.score(thirstyDiesel, MarketSegment.PREMIUM).value()).isEqualTo(4.0);
        assertThat(calculator.score(midPetrol, MarketSegment.PREMIUM).value()).isEqualTo(5.0);
        assertThat(calculator.score(electric, MarketSegment.PREMIUM).value()).isEqualTo(6.0);
    }

    @Test
    void priceRatioToNew() {
        VehicleScoreInput bargain = VehicleScoreInput.builder("Renault", "Clio")
            .price(6_000)
            .newPrice(20_000)
            .build();
        VehicleScoreInput nearlyNew = VehicleScoreInput.builder("Renault", "Clio")
            .price(19_000)
            .newPrice(20_000)
            .build();

        assertThat(calculator.score(bargain, MarketSegment.PREMIUM).value()).isEqualTo(6.5);
        assertThat(calculator.score(nearlyNew, MarketSegment.PREMIUM).value()).isEqualTo(4.0);
    }
}
