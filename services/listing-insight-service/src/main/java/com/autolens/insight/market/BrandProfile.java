package com.autolens.insight.market;

public record BrandProfile(String key, String name, String segmentLabel) {}
