package com.anomalyplatform.common.config;

public enum ThresholdLevel {
    WARNING, ALERT, CRITICAL
}
