package com.anomalyplatform.common.alert;

public record CascadingEffect(
    String effect,
    double probability,
    String timeframe,
    boolean mitigationPossible
) {}
