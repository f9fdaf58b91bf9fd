package com.autolens.insight.scoring.criteria;

import com.autolens.insight.resolver.TextNormalizer;
import java.util.List;
import java.util.Locale;

final class KeywordMatcher {
    private KeywordMatcher() {
    }

    /** Number of texts containing at least one of the stems, ignoring case and accents. */
    static int countMatching(List<String> texts, List<String> stems) {
        if (texts == null || texts.isEmpty()) {
            return 0;
        }
        int matching = 0;
        for (String text : texts) {
            String folded = fold(text);
            for (String stem : stems) {
                if (folded.contains(fold(stem))) {
                    matching++;
                    break;
                }
            }
        }
        return matching;
    }

    static String fold(String text) {
        return TextNormalizer.foldDiacritics(text).toLowerCase(Locale.ROOT);
    }
}
