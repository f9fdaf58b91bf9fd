package com.autolens.insight.scoring.criteria;

import com.autolens.insight.market.Criterion;
import com.autolens.insight.market.MarketSegment;
import com.autolens.insight.scoring.SubScore;
import com.autolens.insight.scoring.VehicleScoreInput;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

public class ResidualValueCalculator implements CriterionCalculator {
    // share of the new price a car keeps, indexed by age in years
    private static final double[] DEPRECIATION_CURVE = {0.95, 0.80, 0.70, 0.60, 0.52, 0.45, 0.40, 0.35};
    private static final double OLD_CAR_RATIO = 0.30;

    private final int referenceYear;

    public ResidualValueCalculator(int referenceYear) {
        this.referenceYear = referenceYear;
    }

    @Override
    public Criterion criterion() {
        return Criterion.RESIDUAL_VALUE;
    }

    @Override
    public SubScore score(VehicleScoreInput input, MarketSegment segment) {
        List<String> details = new ArrayList<>();
        double score = SubScore.NEUTRAL;
        double price = input.getPrice();

        if (input.getCurrentValue() > 0 && price > 0) {
            double ratio = price / input.getCurrentValue();
            if (ratio < 0.9) {
                double bonus = Math.min((1 - ratio) * 10, 2.0);
                score += bonus;
                details.add(String.format(Locale.ROOT, "Priced below market value (%.0f%%): +%.1f", ratio * 100, bonus));
            } else if (ratio > 1.1) {
                double malus = Math.min((ratio - 1) * 5, 1.5);
                score -= malus;
                details.add(String.format(Locale.ROOT, "Priced above market value: -%.1f", malus));
            }
        }

        if (input.getYear() != null && input.getNewPrice() > 0 && price > 0) {
            double expected = expectedRatio(referenceYear - input.getYear());
            double actual = price / input.getNewPrice();
            if (actual > expected * 1.1) {
                score += 1.5;
                details.add("Holds its value well: +1.5");
            } else if (actual < expected * 0.85) {
                score -= 1.0;
                details.add("Fast depreciation: -1.0");
            }
        }

        return new SubScore(score, details);
    }

    public static double expectedRatio(int age) {
        if (age < 0 || age >= DEPRECIATION_CURVE.length) {
            return OLD_CAR_RATIO;
        }
        return DEPRECIATION_CURVE[age];
    }
}
