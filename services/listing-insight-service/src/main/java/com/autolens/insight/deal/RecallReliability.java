package com.autolens.insight.deal;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonValue;

public record RecallReliability(
    @JsonProperty("reliability_score") double score,
    @JsonProperty("reliability_level") Level level,
    @JsonProperty("total_recalls") int totalRecalls,
    @JsonProperty("critical_recalls") int criticalRecalls,
    @JsonProperty("penalty_applied") double penalty,
    @JsonProperty("explanation") String explanation
) {
    public static final String SCORE_TYPE = "estimated_from_recalls";

    @JsonProperty("score_type")
    public String scoreType() {
        return SCORE_TYPE;
    }

    public enum Level {
        EXCELLENT("excellent"),
        GOOD("good"),
        AVERAGE("average"),
        WATCH("watch"),
        CRITICAL("critical");

        private final String code;

        Level(String code) {
            this.code = code;
        }

        @JsonValue
        public String code() {
            return code;
        }
    }
}
