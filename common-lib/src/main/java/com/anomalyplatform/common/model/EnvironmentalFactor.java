package com.anomalyplatform.common.model;

public record EnvironmentalFactor(
    String factor,
    String value,
    ImpactDirection impact,
    double confidence
) {}
