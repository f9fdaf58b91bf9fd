package com.autolens.insight.deal;

import com.autolens.insight.scoring.ScoringProperties;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Rates how good a listing is as a purchase, on a -100..100 scale. Points out of 100: expert score (40),
 * yearly mileage (20), asking price band (30) and reliability alerts (10).
 */
@Component
public class DealEvaluator {
    static final double DEFAULT_EXPERT_SCORE = 10.0;

    private final double goodDealThreshold;
    private final int referenceYear;

    @Autowired
    public DealEvaluator(DealProperties dealProperties, ScoringProperties scoringProperties) {
        this(dealProperties.getGoodDealThreshold(), scoringProperties.getReferenceYear());
    }

    public DealEvaluator(double goodDealThreshold, int referenceYear) {
        this.goodDealThreshold = goodDealThreshold;
        this.referenceYear = referenceYear;
    }

    public DealAssessment evaluate(Double expertScore, Integer price, Integer mileage, Integer year, int reliabilityAlerts) {
        double expert = expertScore == null || expertScore <= 0 ? DEFAULT_EXPERT_SCORE : expertScore;
        double expertPoints = expert / 20.0 * 40.0;
        int mileagePoints = mileagePoints(mileage, year);
        int pricePoints = pricePoints(price);
        int alertPoints = alertPoints(reliabilityAlerts);

        double points = expertPoints + mileagePoints + pricePoints + alertPoints;
        double dealScore = Math.round((points - 50.0) * 2.0 * 10.0) / 10.0;
        dealScore = Math.max(DealAssessment.MIN_SCORE, Math.min(DealAssessment.MAX_SCORE, dealScore));
        return new DealAssessment(dealScore, dealScore > goodDealThreshold, expertPoints, mileagePoints, pricePoints, alertPoints);
    }

    int mileagePoints(Integer mileage, Integer year) {
        if (mileage == null || mileage <= 0 || year == null || year <= 0) {
            return 0;
        }
        int age = Math.max(1, referenceYear - year);
        double kmPerYear = (double) mileage / age;
        if (kmPerYear < 10_000) {
            return 20;
        }
        if (kmPerYear < 15_000) {
            return 15;
        }
        if (kmPerYear < 20_000) {
            return 10;
        }
        return 5;
    }

    static int pricePoints(Integer price) {
        if (price == null || price <= 0) {
            return 0;
        }
        // no market estimate to compare against yet, mid-range prices are favoured
        if (price < 10_000) {
            return 20;
        }
        if (price < 20_000) {
            return 25;
        }
        if (price < 30_000) {
            return 30;
        }
        return 15;
    }

    static int alertPoints(int reliabilityAlerts) {
        if (reliabilityAlerts <= 0) {
            return 10;
        }
        return reliabilityAlerts == 1 ? 5 : 0;
    }
}
