package com.autolens.insight.scoring.criteria;

import com.autolens.insight.market.Criterion;
import com.autolens.insight.market.MarketSegment;
import com.autolens.insight.scoring.SubScore;
import com.autolens.insight.scoring.VehicleScoreInput;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

public class PerformanceCalculator implements CriterionCalculator {
    static final List<String> DYNAMIC_KEYWORDS = List.of(
        "dynamique", "agil", "tenue de route", "direction", "frein", "accélérat"
    );

    private static final Map<MarketSegment, PowerThresholds> THRESHOLDS = thresholds();
    private static final PowerThresholds DEFAULT_THRESHOLDS = new PowerThresholds(130, 180);

    @Override
    public Criterion criterion() {
        return Criterion.PERFORMANCE;
    }

    @Override
    public SubScore score(VehicleScoreInput input, MarketSegment segment) {
        List<String> details = new ArrayList<>();
        double score = SubScore.NEUTRAL;

        int power = input.getPowerHp();
        if (power > 0) {
            PowerThresholds refs = thresholdsFor(segment);
            if (power >= refs.excellent()) {
                score += 2.0;
                details.add(String.format(Locale.ROOT, "Excellent power (%dhp): +2.0", power));
            } else if (power >= refs.good()) {
                score += 1.0;
                details.add(String.format(Locale.ROOT, "Good power (%dhp): +1.0", power));
            } else if (power < refs.good() * 0.6) {
                score -= 1.0;
                details.add(String.format(Locale.ROOT, "Limited power (%dhp): -1.0", power));
            }
        }

        int dynamic = KeywordMatcher.countMatching(input.getPros(), DYNAMIC_KEYWORDS);
        if (dynamic > 0) {
            double bonus = Math.min(dynamic * 0.4, 1.5);
            score += bonus;
            details.add(String.format(Locale.ROOT, "Dynamic qualities (%d): +%.1f", dynamic, bonus));
        }

        return new SubScore(score, details);
    }

    public static PowerThresholds thresholdsFor(MarketSegment segment) {
        if (segment == null) {
            return DEFAULT_THRESHOLDS;
        }
        return THRESHOLDS.getOrDefault(segment, DEFAULT_THRESHOLDS);
    }

    private static Map<MarketSegment, PowerThresholds> thresholds() {
        Map<MarketSegment, PowerThresholds> refs = new EnumMap<>(MarketSegment.class);
        refs.put(MarketSegment.BUDGET, new PowerThresholds(90, 110));
        refs.put(MarketSegment.VOLUME, new PowerThresholds(130, 180));
        refs.put(MarketSegment.PREMIUM, new PowerThresholds(180, 250));
        refs.put(MarketSegment.LUXURY_SPORT, new PowerThresholds(300, 450));
        refs.put(MarketSegment.ELECTRIC_FIRST, new PowerThresholds(300, 450));
        return refs;
    }

    public record PowerThresholds(int good, int excellent) {}
}
