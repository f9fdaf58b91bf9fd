package com.autolens.insight.scoring.criteria;

import com.autolens.insight.market.Criterion;
import com.autolens.insight.market.MarketSegment;
import com.autolens.insight.scoring.SubScore;
import com.autolens.insight.scoring.VehicleScoreInput;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

public class ReliabilityCalculator implements CriterionCalculator {
    private static final double ISSUE_PENALTY = 0.3;
    private static final double MAX_ISSUE_PENALTY = 2.0;
    private static final int LARGE_REVIEW_BASE = 50;
    private static final double PROVEN_RELIABILITY = 7.0;
    private static final int HIGH_MILEAGE_KM = 150_000;

    @Override
    public Criterion criterion() {
        return Criterion.RELIABILITY;
    }

    @Override
    public SubScore score(VehicleScoreInput input, MarketSegment segment) {
        List<String> details = new ArrayList<>();
        double score = SubScore.NEUTRAL;

        if (input.getReliabilityScore() > 0) {
            score = input.getReliabilityScore();
            details.add(String.format(Locale.ROOT, "Reported reliability: %.1f/10", score));
        }

        int issues = input.getKnownIssues().size();
        if (issues > 0) {
            double penalty = Math.min(issues * ISSUE_PENALTY, MAX_ISSUE_PENALTY);
            score -= penalty;
            details.add(String.format(Locale.ROOT, "Known issues (%d): -%.1f", issues, penalty));
        }

        if (input.getReviewCount() > LARGE_REVIEW_BASE && input.getReliabilityScore() >= PROVEN_RELIABILITY) {
            score += 0.5;
            details.add("Large base of positive reviews: +0.5");
        }

        // proven reliability absorbs high mileage
        if (input.getMileage() > HIGH_MILEAGE_KM && score < PROVEN_RELIABILITY) {
            score -= 0.5;
            details.add("High mileage with average reliability: -0.5");
        }

        return new SubScore(score, details);
    }
}
