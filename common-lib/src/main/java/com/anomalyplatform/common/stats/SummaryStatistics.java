package com.anomalyplatform.common.stats;

/** Population statistics of a sample. */
public record SummaryStatistics(int count, double mean, double stddev, double median) {}
