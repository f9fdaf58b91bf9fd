package com.autolens.insight.scoring.criteria;

import com.autolens.insight.market.Criterion;
import com.autolens.insight.market.MarketSegment;
import com.autolens.insight.scoring.SubScore;
import com.autolens.insight.scoring.VehicleScoreInput;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

public class SafetyCalculator implements CriterionCalculator {
    static final List<String> SAFETY_KEYWORDS = List.of(
        "sécurité", "airbag", "assist", "freinage", "ada", "ncap", "étoiles"
    );

    @Override
    public Criterion criterion() {
        return Criterion.SAFETY;
    }

    @Override
    public SubScore score(VehicleScoreInput input, MarketSegment segment) {
        List<String> details = new ArrayList<>();
        double score = SubScore.NEUTRAL;

        Integer year = input.getYear();
        if (year != null && year > 0) {
            if (year >= 2022) {
                score += 2.0;
                details.add("Recent vehicle (2022+ safety standards): +2.0");
            } else if (year >= 2019) {
                score += 1.0;
                details.add("2019+ safety standards: +1.0");
            } else if (year < 2015) {
                score -= 1.0;
                details.add("Dated safety standards: -1.0");
            }
        }

        int equipment = KeywordMatcher.countMatching(input.getPros(), SAFETY_KEYWORDS);
        if (equipment > 0) {
            double bonus = Math.min(equipment * 0.5, 1.5);
            score += bonus;
            details.add(String.format(Locale.ROOT, "Safety equipment (%d): +%.1f", equipment, bonus));
        }

        return new SubScore(score, details);
    }
}
