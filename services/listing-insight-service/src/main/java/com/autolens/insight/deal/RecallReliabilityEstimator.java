package com.autolens.insight.deal;

import java.util.List;
import java.util.Locale;
import org.springframework.stereotype.Component;

/**
 * Estimates a /10 reliability figure from safety recalls when no survey-based score is known for a model.
 */
@Component
public class RecallReliabilityEstimator {
    static final double BASE_SCORE = 10.0;
    static final double CRITICAL_PENALTY = 0.5;
    static final List<String> CRITICAL_KEYWORDS = List.of("frein", "airbag", "direction", "incendie", "feu", "ceinture");

    public RecallReliability estimate(List<RecallNotice> recalls) {
        List<RecallNotice> notices = recalls == null ? List.of() : recalls;
        return estimate(notices.size(), notices);
    }

    /**
     * @param totalRecalls count reported by the recall registry, which may exceed the notices returned
     */
    public RecallReliability estimate(int totalRecalls, List<RecallNotice> recalls) {
        int total = Math.max(0, totalRecalls);
        double penalty;
        RecallReliability.Level level;
        if (total == 0) {
            penalty = 0.0;
            level = RecallReliability.Level.EXCELLENT;
        } else if (total <= 2) {
            penalty = 0.5 * total;
            level = RecallReliability.Level.GOOD;
        } else if (total <= 5) {
            penalty = 1.0 + 0.3 * (total - 2);
            level = RecallReliability.Level.AVERAGE;
        } else if (total <= 10) {
            penalty = 2.0 + 0.2 * (total - 5);
            level = RecallReliability.Level.WATCH;
        } else {
            penalty = 3.0 + 0.1 * (total - 10);
            level = RecallReliability.Level.CRITICAL;
        }

        int critical = 0;
        if (recalls != null) {
            for (RecallNotice recall : recalls) {
                if (recall != null && isCritical(recall)) {
                    critical++;
                    penalty += CRITICAL_PENALTY;
                }
            }
        }

        double score = Math.max(0.0, Math.min(BASE_SCORE, BASE_SCORE - penalty));
        String explanation = "Estimated from " + total + " recall(s), " + critical + " critical";
        return new RecallReliability(round1(score), level, total, critical, round1(penalty), explanation);
    }

    static boolean isCritical(RecallNotice recall) {
        String combined = (nullToEmpty(recall.reason()) + " " + nullToEmpty(recall.risks())).toLowerCase(Locale.ROOT);
        for (String keyword : CRITICAL_KEYWORDS) {
            if (combined.contains(keyword)) {
                return true;
            }
        }
        return false;
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }

    private static double round1(double value) {
        return Math.round(value * 10.0) / 10.0;
    }
}
