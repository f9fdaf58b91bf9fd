package com.autolens.insight.scoring;

import static org.assertj.core.api.Assertions.assertThat;

import com.autolens.insight.market.MarketTablesLoader;
import com.autolens.insight.market.SegmentClassifier;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.List;
import org.junit.jupiter.api.Test;

class VehicleScoreOutputJsonTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    @Test
    void serializesWithSnakeCaseKeys() throws Exception {
        SegmentClassifier classifier =
            new SegmentClassifier(new MarketTablesLoader().load("classpath:config/market-tables.yaml"));
        VehicleScoreOutput output = new ContextualScorer(() -> classifier, 2026).score(
            VehicleScoreInput.builder("Peugeot", "3008")
                .year(2021)
                .pros(List.of("Confortable"))
                .build()
        );

        JsonNode json = objectMapper.readTree(objectMapper.writeValueAsString(output));

        assertThat(json.get("score_global").isNumber()).isTrue();
        assertThat(json.get("segment").asText()).isEqualTo("Volume");
        assertThat(json.get("category").asText()).isEqualTo("C-SUV");
        assertThat(json.get("scores").has("cost_of_use")).isTrue();
        assertThat(json.get("scores").has("autonomy")).isFalse();
        assertThat(json.get("weights").get("reliability").asDouble()).isEqualTo(0.25);
        assertThat(json.get("details").get("comfort").get(0).asText()).startsWith("Comfort qualities");
        assertThat(json.has("reliability")).isFalse();
        assertThat(json.get("verdict").asText()).contains("Volume weights");
    }
}
