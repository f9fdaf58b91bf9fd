package com.autolens.insight.scoring.criteria;

import com.autolens.insight.market.Criterion;
import com.autolens.insight.market.MarketSegment;
import com.autolens.insight.scoring.SubScore;
import com.autolens.insight.scoring.VehicleScoreInput;

/**
 * One /10 criterion. Implementations start from {@link SubScore#NEUTRAL} when data is missing and
 * never throw on absent optional input.
 */
public interface CriterionCalculator {

    Criterion criterion();

    SubScore score(VehicleScoreInput input, MarketSegment segment);
}
