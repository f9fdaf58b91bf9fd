package com.autolens.insight.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.autolens.insight.deal.DealEvaluator;
import com.autolens.insight.deal.RecallNotice;
import com.autolens.insight.deal.RecallReliabilityEstimator;
import com.autolens.insight.market.MarketSegment;
import com.autolens.insight.market.MarketTablesLoader;
import com.autolens.insight.market.SegmentClassifier;
import com.autolens.insight.market.VehicleCategory;
import com.autolens.insight.resolver.FuelType;
import com.autolens.insight.resolver.InvalidListingException;
import com.autolens.insight.scoring.ContextualScorer;
import com.autolens.insight.scoring.VehicleScoreInput;
import com.autolens.insight.scoring.VehicleScoreOutput;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class ListingAnalysisServiceTest {

    @Mock
    private ContextualScorer mockScorer;

    private SimpleMeterRegistry meterRegistry;
    private ListingAnalysisService service;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        SegmentClassifier classifier =
            new SegmentClassifier(new MarketTablesLoader().load("classpath:config/market-tables.yaml"));
        service = new ListingAnalysisService(
            new ContextualScorer(() -> classifier, 2026),
            new DealEvaluator(20.0, 2026),
            new RecallReliabilityEstimator(),
            meterRegistry
        );
    }

    @Test
    void analyzesCompleteListing() {
        ListingSnapshot listing = new ListingSnapshot(
            "Peugeot 3008 1.2 PureTech 130ch Allure BVA 2021",
            "Boîte automatique, essence, 45000km"
        );
        listing.setPrice(22_000);
        listing.setMileage(45_000);
        VehicleEnrichment enrichment = new VehicleEnrichment();
        enrichment.setReliabilityScore(7.5);
        enrichment.setReviewCount(120);
        enrichment.setConsumption(5.8);

        ListingAnalysis analysis = service.analyze(listing, enrichment);

        assertThat(analysis.brand()).isEqualTo("Peugeot");
        assertThat(analysis.features().fuel()).isEqualTo(FuelType.PETROL);
        assertThat(analysis.catalogQuery().completeness()).isEqualTo("full");
        assertThat(analysis.referenceQuery().brand()).isEqualTo("PEUGEOT");
        assertThat(analysis.score().getSegment()).isEqualTo(MarketSegment.VOLUME);
        assertThat(analysis.score().getCategory()).isEqualTo(VehicleCategory.UNKNOWN);
        assertThat(analysis.score().getReliability()).isEqualTo(8.0);
        assertThat(analysis.deal()).isNotNull();
        assertThat(analysis.recallReliability()).isNull();
        assertThat(meterRegistry.counter("li_listing_analysis_total", "completeness", "full").count()).isEqualTo(1.0);
    }

    @Test
    void rejectsListingWithoutTitle() {
        assertThatThrownBy(() -> service.analyze(new ListingSnapshot(" ", "desc")))
            .isInstanceOf(InvalidListingException.class);
        assertThatThrownBy(() -> service.analyze(null))
            .isInstanceOf(InvalidListingException.class);

        assertThat(meterRegistry.counter("li_listing_rejected_total").count()).isEqualTo(2.0);
    }

    @Test
    void countsSegmentFallbackForUnknownBrand() {
        ListingAnalysis analysis = service.analyze(new ListingSnapshot("Trabant 601 essence 2019", null));

        assertThat(analysis.brand()).isNull();
        assertThat(analysis.score().getSegment()).isEqualTo(MarketSegment.VOLUME);
        assertThat(meterRegistry.counter("li_segment_fallback_total", "stage", "brand_default").count()).isEqualTo(1.0);
        assertThat(meterRegistry.counter("li_listing_analysis_total", "completeness", "partial").count()).isEqualTo(1.0);
    }

    @Test
    void buildsScoreInputFromFeaturesAndRecalls() {
        when(mockScorer.score(any())).thenReturn(new VehicleScoreOutput(
            12.0, Map.of(), MarketSegment.VOLUME, VehicleCategory.B, 0.5,
            List.of(), List.of(), "verdict", Map.of(), Map.of()
        ));
        ListingAnalysisService mocked = new ListingAnalysisService(
            mockScorer,
            new DealEvaluator(20.0, 2026),
            new RecallReliabilityEstimator(),
            meterRegistry
        );
        ListingSnapshot listing = new ListingSnapshot("Renault Clio 90ch diesel", "Très bon état");
        listing.setYear(2019);
        listing.setPrice(9_000);
        listing.setMileage(60_000);
        VehicleEnrichment enrichment = new VehicleEnrichment();
        enrichment.setRecalls(List.of(
            new RecallNotice("Défaut de freinage", null),
            new RecallNotice("Calculateur moteur", "Perte de puissance")
        ));

        ListingAnalysis analysis = mocked.analyze(listing, enrichment);

        ArgumentCaptor<VehicleScoreInput> captor = ArgumentCaptor.forClass(VehicleScoreInput.class);
        verify(mockScorer).score(captor.capture());
        VehicleScoreInput input = captor.getValue();
        assertThat(input.getBrand()).isEqualTo("Renault");
        assertThat(input.getModel()).isEqualTo("CLIO");
        assertThat(input.getYear()).isEqualTo(2019);
        assertThat(input.getFuelLabel()).isEqualTo("diesel");
        assertThat(input.getPowerHp()).isEqualTo(90);
        // two recalls, one of them on the brakes
        assertThat(input.getReliabilityScore()).isEqualTo(8.5);
        assertThat(analysis.recallReliability().criticalRecalls()).isEqualTo(1);
        // 24 expert + 20 mileage + 20 price + 10 alerts
        assertThat(analysis.deal().dealScore()).isEqualTo(48.0);
        assertThat(analysis.deal().goodDeal()).isTrue();
        assertThat(meterRegistry.find("li_segment_fallback_total").counter()).isNull();
    }

    @Test
    void fallbackCounterFollowsScoredSegment() {
        when(mockScorer.score(any())).thenReturn(new VehicleScoreOutput(
            11.0, Map.of(), MarketSegment.VOLUME, VehicleCategory.UNKNOWN, 0.3,
            List.of(), List.of(), "verdict", Map.of(), Map.of(), SegmentClassifier.STAGE_SEGMENT_MAPPING
        ));
        ListingAnalysisService mocked = new ListingAnalysisService(
            mockScorer,
            new DealEvaluator(20.0, 2026),
            new RecallReliabilityEstimator(),
            meterRegistry
        );

        mocked.analyze(new ListingSnapshot("Renault Clio 90ch diesel 2019", null));

        assertThat(meterRegistry.counter("li_segment_fallback_total", "stage", SegmentClassifier.STAGE_SEGMENT_MAPPING).count())
            .isEqualTo(1.0);
    }
}
