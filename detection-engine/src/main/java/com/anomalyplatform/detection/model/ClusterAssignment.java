package com.anomalyplatform.detection.model;

/** Nearest cluster for a snapshot and the distance to its center. */
public record ClusterAssignment(String clusterId, int index, double distance) {}
