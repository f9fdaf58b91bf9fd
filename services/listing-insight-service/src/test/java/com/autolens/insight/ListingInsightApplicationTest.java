package com.autolens.insight;

import static org.assertj.core.api.Assertions.assertThat;

import com.autolens.insight.market.MarketTablesService;
import com.autolens.insight.service.ListingAnalysis;
import com.autolens.insight.service.ListingAnalysisService;
import com.autolens.insight.service.ListingSnapshot;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

@SpringBootTest
class ListingInsightApplicationTest {

    @Autowired
    private MarketTablesService marketTablesService;

    @Autowired
    private ListingAnalysisService listingAnalysisService;

    @Autowired
    private ObjectMapper objectMapper;

    @Test
    void loadsTablesAndAnalyzesListing() throws Exception {
        assertThat(marketTablesService.getTables().getVersion()).isEqualTo("mt_2026_1");

        ListingAnalysis analysis = listingAnalysisService.analyze(new ListingSnapshot("BMW 320d 2018", "Boîte manuelle"));
        JsonNode json = objectMapper.readTree(objectMapper.writeValueAsString(analysis));

        assertThat(json.get("brand").asText()).isEqualTo("BMW");
        assertThat(json.get("features").get("fuel").asText()).isEqualTo("diesel");
        assertThat(json.get("features").has("raw_text")).isFalse();
        assertThat(json.get("catalog_query").get("query_completeness").asText()).isEqualTo("partial");
        assertThat(json.get("reference_query").get("source").asText()).isEqualTo("ademe_car_labelling");
        assertThat(json.get("score").get("segment").asText()).isEqualTo("Premium");
        assertThat(json.get("deal").has("deal_score")).isTrue();
        assertThat(json.has("recall_reliability")).isFalse();
    }
}
