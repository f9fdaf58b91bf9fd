package com.autolens.insight.service;

import com.autolens.insight.deal.DealAssessment;
import com.autolens.insight.deal.DealEvaluator;
import com.autolens.insight.deal.RecallReliability;
import com.autolens.insight.deal.RecallReliabilityEstimator;
import com.autolens.insight.resolver.CatalogQuery;
import com.autolens.insight.resolver.FuelType;
import com.autolens.insight.resolver.InvalidListingException;
import com.autolens.insight.resolver.ListingResolver;
import com.autolens.insight.resolver.VehicleFeatures;
import com.autolens.insight.scoring.ContextualScorer;
import com.autolens.insight.scoring.VehicleScoreInput;
import com.autolens.insight.scoring.VehicleScoreOutput;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
public class ListingAnalysisService {
    private static final Logger log = LoggerFactory.getLogger(ListingAnalysisService.class);

    private final ContextualScorer scorer;
    private final DealEvaluator dealEvaluator;
    private final RecallReliabilityEstimator recallEstimator;
    private final MeterRegistry meterRegistry;

    public ListingAnalysisService(
        ContextualScorer scorer,
        DealEvaluator dealEvaluator,
        RecallReliabilityEstimator recallEstimator,
        MeterRegistry meterRegistry
    ) {
        this.scorer = scorer;
        this.dealEvaluator = dealEvaluator;
        this.recallEstimator = recallEstimator;
        this.meterRegistry = meterRegistry;
    }

    public ListingAnalysis analyze(ListingSnapshot listing) {
        return analyze(listing, null);
    }

    public ListingAnalysis analyze(ListingSnapshot listing, VehicleEnrichment enrichment) {
        if (listing == null) {
            meterRegistry.counter("li_listing_rejected_total").increment();
            throw new InvalidListingException("listing is required");
        }
        ListingResolver resolver;
        try {
            resolver = new ListingResolver(listing.getTitle(), listing.getDescription());
        } catch (InvalidListingException ex) {
            meterRegistry.counter("li_listing_rejected_total").increment();
            throw ex;
        }

        VehicleFeatures features = resolver.extractFeatures();
        CatalogQuery catalogQuery = resolver.catalogQuery();
        String brand = catalogQuery.brand();
        String model = catalogQuery.model();
        Integer year = features.year() != null ? features.year() : declaredYear(listing.getYear());

        VehicleEnrichment extra = enrichment == null ? new VehicleEnrichment() : enrichment;
        RecallReliability recallReliability = estimateFromRecalls(extra);
        double reliability = positive(extra.getReliabilityScore());
        if (reliability <= 0 && recallReliability != null) {
            reliability = recallReliability.score();
        }

        VehicleScoreInput input = VehicleScoreInput.builder(brand, model)
            .year(year)
            .price(listing.getPrice() == null ? 0 : listing.getPrice())
            .mileage(listing.getMileage() == null ? 0 : listing.getMileage())
            .fuelLabel(features.fuel() == FuelType.UNKNOWN ? null : features.fuel().code())
            .powerHp(features.powerHp() == null ? 0 : features.powerHp())
            .reliabilityScore(reliability)
            .reviewCount(extra.getReviewCount() == null ? 0 : extra.getReviewCount())
            .knownIssues(extra.getKnownIssues())
            .pros(extra.getPros())
            .cons(extra.getCons())
            .consumption(positive(extra.getConsumption()))
            .co2(extra.getCo2() == null ? 0 : extra.getCo2())
            .newPrice(positive(extra.getNewPrice()))
            .currentValue(positive(extra.getCurrentValue()))
            .build();

        VehicleScoreOutput score = scorer.score(input);
        score.getSegmentFallbackStage().ifPresent(stage ->
            meterRegistry.counter("li_segment_fallback_total", "stage", stage).increment()
        );

        List<String> alerts = extra.getReliabilityAlerts();
        DealAssessment deal = dealEvaluator.evaluate(
            score.getScoreGlobal(),
            listing.getPrice(),
            listing.getMileage(),
            year,
            alerts == null ? 0 : alerts.size()
        );

        meterRegistry.counter("li_listing_analysis_total", "completeness", catalogQuery.completeness()).increment();
        log.debug("listing analysed brand={} model={} completeness={} score={} deal={}",
            brand, model, catalogQuery.completeness(), score.getScoreGlobal(), deal.dealScore());

        return new ListingAnalysis(
            brand,
            model,
            features,
            catalogQuery,
            resolver.referenceQuery(),
            score,
            deal,
            recallReliability
        );
    }

    private RecallReliability estimateFromRecalls(VehicleEnrichment enrichment) {
        if (enrichment.getRecallCount() == null && enrichment.getRecalls() == null) {
            return null;
        }
        if (enrichment.getRecallCount() == null) {
            return recallEstimator.estimate(enrichment.getRecalls());
        }
        return recallEstimator.estimate(enrichment.getRecallCount(), enrichment.getRecalls());
    }

    private static Integer declaredYear(Integer year) {
        return VehicleFeatures.isValidYear(year) ? year : null;
    }

    private static double positive(Double value) {
        return value == null || value <= 0 ? 0.0 : value;
    }
}
