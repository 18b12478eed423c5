package com.anomalyplatform.common.model;

import java.time.Instant;

/** A deliberate change in training load (type is increase, decrease or redistribution). */
public record LoadChange(Instant date, String type, double magnitude, String reason) {}
