package com.autolens.insight.deal;

import com.fasterxml.jackson.annotation.JsonProperty;

/** A manufacturer safety recall as published for a model. */
public record RecallNotice(
    @JsonProperty("reason") String reason,
    @JsonProperty("risks") String risks
) {}
