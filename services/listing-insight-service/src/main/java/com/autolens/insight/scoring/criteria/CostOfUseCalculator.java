package com.autolens.insight.scoring.criteria;

import com.autolens.insight.market.Criterion;
import com.autolens.insight.market.MarketSegment;
import com.autolens.insight.scoring.SubScore;
import com.autolens.insight.scoring.VehicleScoreInput;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

public class CostOfUseCalculator implements CriterionCalculator {

    @Override
    public Criterion criterion() {
        return Criterion.COST_OF_USE;
    }

    @Override
    public SubScore score(VehicleScoreInput input, MarketSegment segment) {
        List<String> details = new ArrayList<>();
        double score = SubScore.NEUTRAL;

        double consumption = input.getConsumption();
        if (consumption > 0) {
            FuelFamily family = FuelFamily.detect(input.getFuelLabel(), input.getModel());
            if (consumption <= family.excellent()) {
                score += 2.5;
                details.add(String.format(Locale.ROOT, "Excellent consumption (%.1f%s/100km): +2.5",
                    consumption, family.unit()));
            } else if (consumption <= family.average()) {
                score += 1.0;
                details.add(String.format(Locale.ROOT, "Reasonable consumption (%.1f%s/100km): +1.0",
                    consumption, family.unit()));
            } else if (consumption >= family.poor()) {
                score -= 1.0;
                details.add(String.format(Locale.ROOT, "High consumption (%.1f%s/100km): -1.0",
                    consumption, family.unit()));
            }
        }

        if (input.getNewPrice() > 0 && input.getPrice() > 0) {
            double ratio = input.getPrice() / input.getNewPrice();
            if (ratio < 0.4) {
                score += 1.5;
                details.add(String.format(Locale.ROOT, "Excellent value (price at %.0f%% of new): +1.5", ratio * 100));
            } else if (ratio < 0.6) {
                score += 0.5;
                details.add("Good value for money: +0.5");
            } else if (ratio > 0.85) {
                score -= 1.0;
                details.add("Price close to new: -1.0");
            }
        }

        if ((segment == MarketSegment.BUDGET || segment == MarketSegment.VOLUME) && score >= 7.0) {
            score += 0.5;
            details.add("Running costs weigh more in " + segment.key() + ": +0.5");
        }

        return new SubScore(score, details);
    }
}
