package com.anomalyplatform.detection.model;

import com.anomalyplatform.common.model.EntityRef;

/**
 * Per-entity element of a batch: a report, or an explicit error record. Never both.
 */
public record EntityDetectionResult(EntityRef entity, DetectionReport report, String error) {

    public static EntityDetectionResult success(DetectionReport report) {
        return new EntityDetectionResult(report.entity(), report, null);
    }

    public static EntityDetectionResult failure(EntityRef entity, String error) {
        return new EntityDetectionResult(entity, null, error);
    }

    public boolean isSuccess() {
        return error == null;
    }
}
