package com.anomalyplatform.detection.detector;

import com.anomalyplatform.common.config.DetectorKind;
import com.anomalyplatform.common.exception.DetectorException;
import com.anomalyplatform.common.exception.InsufficientDataException;
import com.anomalyplatform.detection.model.DetectionInput;
import com.anomalyplatform.detection.model.RawFinding;

import java.util.List;

/**
 * One independent anomaly-finding algorithm.
 *
 * <p>Implementations are pure functions of the {@link DetectionInput}: no I/O, no shared
 * mutable state. The orchestrator may run all detectors of one entity concurrently.
 */
public interface AnomalyDetector {

    DetectorKind kind();

    default String detectorName() {
        return kind().detectorName();
    }

    /**
     * @return findings in a stable order, possibly empty
     * @throws InsufficientDataException when the input is too thin to evaluate; the
     *         detector is reported as skipped
     * @throws DetectorException for any other detector failure
     */
    List<RawFinding> detect(DetectionInput input);
}
