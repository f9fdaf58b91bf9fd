package com.autolens.insight.scoring.criteria;

import com.autolens.insight.market.Criterion;
import com.autolens.insight.market.MarketSegment;
import com.autolens.insight.scoring.SubScore;
import com.autolens.insight.scoring.VehicleScoreInput;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

public class ComfortCalculator implements CriterionCalculator {
    static final List<String> COMFORT_KEYWORDS = List.of(
        "confort", "silenc", "suspens", "insonori", "espace", "habitab"
    );

    @Override
    public Criterion criterion() {
        return Criterion.COMFORT;
    }

    @Override
    public SubScore score(VehicleScoreInput input, MarketSegment segment) {
        List<String> details = new ArrayList<>();
        double score = SubScore.NEUTRAL;

        int positives = KeywordMatcher.countMatching(input.getPros(), COMFORT_KEYWORDS);
        if (positives > 0) {
            double bonus = Math.min(positives * 0.5, 2.0);
            score += bonus;
            details.add(String.format(Locale.ROOT, "Comfort qualities (%d): +%.1f", positives, bonus));
        }

        int negatives = KeywordMatcher.countMatching(input.getCons(), COMFORT_KEYWORDS);
        if (negatives > 0) {
            double malus = Math.min(negatives * 0.5, 1.5);
            score -= malus;
            details.add(String.format(Locale.ROOT, "Comfort drawbacks (%d): -%.1f", negatives, malus));
        }

        // buyers expect more in the upper segments
        if (segment == MarketSegment.PREMIUM || segment == MarketSegment.LUXURY_SPORT) {
            if (score >= 7.0) {
                score += 1.0;
                details.add("Premium comfort confirmed: +1.0");
            } else if (score < 5.0) {
                score -= 0.5;
                details.add("Comfort below " + segment.key() + " expectations: -0.5");
            }
        }

        return new SubScore(score, details);
    }
}
