package com.autolens.insight.scoring;

import com.autolens.insight.market.Criterion;
import com.autolens.insight.market.MarketSegment;
import com.autolens.insight.market.MarketTablesService;
import com.autolens.insight.market.SegmentClassifier;
import com.autolens.insight.market.SegmentWeights;
import com.autolens.insight.scoring.criteria.ComfortCalculator;
import com.autolens.insight.scoring.criteria.CostOfUseCalculator;
import com.autolens.insight.scoring.criteria.CriterionCalculator;
import com.autolens.insight.scoring.criteria.PerformanceCalculator;
import com.autolens.insight.scoring.criteria.ReliabilityCalculator;
import com.autolens.insight.scoring.criteria.ResidualValueCalculator;
import com.autolens.insight.scoring.criteria.SafetyCalculator;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Scores a vehicle /20 relative to its market segment: a city car is not held to the comfort or
 * power standards of a premium saloon, and the weights of the six criteria change per segment.
 */
@Component
public class ContextualScorer {
    private static final Logger log = LoggerFactory.getLogger(ContextualScorer.class);

    static final double STRENGTH_THRESHOLD = 7.0;
    static final double WEAKNESS_THRESHOLD = 5.0;
    private static final int VERDICT_WEIGHTS = 3;

    private static final Map<Criterion, String[]> EXPLANATIONS = explanations();

    private final Supplier<SegmentClassifier> classifierSupplier;
    private final List<CriterionCalculator> calculators;

    @Autowired
    public ContextualScorer(MarketTablesService marketTablesService, ScoringProperties properties) {
        this(marketTablesService::getClassifier, properties.getReferenceYear());
    }

    public ContextualScorer(Supplier<SegmentClassifier> classifierSupplier, int referenceYear) {
        this.classifierSupplier = classifierSupplier;
        this.calculators = List.of(
            new ReliabilityCalculator(),
            new CostOfUseCalculator(),
            new ComfortCalculator(),
            new SafetyCalculator(),
            new PerformanceCalculator(),
            new ResidualValueCalculator(referenceYear)
        );
    }

    public VehicleScoreOutput score(VehicleScoreInput input) {
        // one snapshot per call so a concurrent reload cannot mix two tables
        SegmentClassifier classifier = classifierSupplier.get();
        SegmentClassifier.SegmentResolution resolution = classifier.classify(input.getBrand());
        MarketSegment segment = resolution.segment();
        SegmentWeights weights = classifier.weightsFor(segment).value();

        Map<Criterion, SubScore> subScores = new EnumMap<>(Criterion.class);
        for (CriterionCalculator calculator : calculators) {
            subScores.put(calculator.criterion(), calculator.score(input, segment));
        }

        double score20 = aggregate(subScores, weights);
        double confidence = confidence(input);

        List<String> strengths = new ArrayList<>();
        List<String> weaknesses = new ArrayList<>();
        for (Map.Entry<Criterion, SubScore> entry : subScores.entrySet()) {
            String[] texts = EXPLANATIONS.get(entry.getKey());
            double value = entry.getValue().value();
            if (value >= STRENGTH_THRESHOLD) {
                strengths.add(texts[0]);
            } else if (value < WEAKNESS_THRESHOLD) {
                weaknesses.add(texts[1]);
            }
        }

        Map<Criterion, Double> rounded = new EnumMap<>(Criterion.class);
        Map<Criterion, List<String>> details = new EnumMap<>(Criterion.class);
        for (Map.Entry<Criterion, SubScore> entry : subScores.entrySet()) {
            rounded.put(entry.getKey(), round1(entry.getValue().value()));
            details.put(entry.getKey(), entry.getValue().details());
        }

        log.debug("scored brand={} segment={} via={} score={}",
            input.getBrand(), segment.key(), resolution.brandStage(), score20);

        return new VehicleScoreOutput(
            round1(score20),
            rounded,
            segment,
            CategoryDetector.detect(input.getModel()),
            round2(confidence),
            strengths,
            weaknesses,
            verdict(score20, segment, weights),
            details,
            weights.asMap(),
            resolution.fallbackStage().orElse(null)
        );
    }

    /**
     * Weighted sum doubled to a /20 scale. Weights are expected to sum to 1.0 (checked when the tables
     * load) so the sum is not renormalized.
     */
    static double aggregate(Map<Criterion, SubScore> subScores, SegmentWeights weights) {
        double weighted = 0.0;
        double totalWeight = 0.0;
        for (Map.Entry<Criterion, Double> entry : weights.asMap().entrySet()) {
            Criterion criterion = entry.getKey();
            double value;
            if (criterion == Criterion.AUTONOMY) {
                value = (valueOf(subScores, Criterion.COST_OF_USE) + valueOf(subScores, Criterion.PERFORMANCE)) / 2;
            } else {
                value = valueOf(subScores, criterion);
            }
            weighted += value * entry.getValue();
            totalWeight += entry.getValue();
        }
        if (totalWeight > 0) {
            return clamp(weighted * 2, 0.0, 20.0);
        }
        double sum = 0.0;
        for (SubScore subScore : subScores.values()) {
            sum += subScore.value();
        }
        return clamp(sum / 3, 0.0, 20.0);
    }

    static double confidence(VehicleScoreInput input) {
        double confidence = 0.3;
        if (input.getReliabilityScore() > 0) {
            confidence += 0.2;
        }
        if (!input.getPros().isEmpty() || !input.getCons().isEmpty()) {
            confidence += 0.15;
        }
        if (input.getNewPrice() > 0) {
            confidence += 0.15;
        }
        if (input.getConsumption() > 0) {
            confidence += 0.1;
        }
        if (input.getReviewCount() > 20) {
            confidence += 0.1;
        }
        return Math.min(1.0, confidence);
    }

    static String verdict(double score20, MarketSegment segment, SegmentWeights weights) {
        String head;
        if (score20 >= 16) {
            head = "Excellent choice in the " + segment.key() + " segment";
        } else if (score20 >= 13) {
            head = "Good vehicle for the " + segment.key() + " segment";
        } else if (score20 >= 10) {
            head = "Fair, but alternatives exist in " + segment.key();
        } else {
            head = "Consider with caution";
        }
        List<String> parts = new ArrayList<>();
        for (Map.Entry<Criterion, Double> entry : weights.dominant(VERDICT_WEIGHTS)) {
            parts.add(String.format(Locale.ROOT, "%s %.0f%%", entry.getKey().label(), entry.getValue() * 100));
        }
        String weighting = parts.isEmpty() ? "unweighted average" : String.join(", ", parts);
        return head + " | " + segment.key() + " weights: " + weighting;
    }

    private static double valueOf(Map<Criterion, SubScore> subScores, Criterion criterion) {
        SubScore subScore = subScores.get(criterion);
        return subScore == null ? SubScore.NEUTRAL : subScore.value();
    }

    private static double clamp(double value, double min, double max) {
        return Math.max(min, Math.min(max, value));
    }

    private static double round1(double value) {
        return Math.round(value * 10.0) / 10.0;
    }

    private static double round2(double value) {
        return Math.round(value * 100.0) / 100.0;
    }

    private static Map<Criterion, String[]> explanations() {
        Map<Criterion, String[]> texts = new EnumMap<>(Criterion.class);
        texts.put(Criterion.RELIABILITY, new String[] {"Proven reliability", "Reliability could be better"});
        texts.put(Criterion.COST_OF_USE, new String[] {"Controlled running costs", "High running costs"});
        texts.put(Criterion.COMFORT, new String[] {"Good comfort", "Comfort below expectations"});
        texts.put(Criterion.SAFETY, new String[] {"Modern safety standards", "Dated safety standards"});
        texts.put(Criterion.PERFORMANCE, new String[] {"Satisfying performance", "Limited performance"});
        texts.put(Criterion.RESIDUAL_VALUE, new String[] {"Holds its value well", "Fast depreciation"});
        return texts;
    }
}
