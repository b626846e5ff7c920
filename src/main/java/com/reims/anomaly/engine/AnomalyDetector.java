package com.reims.anomaly.engine;

import com.reims.anomaly.model.DetectionRun;
import com.reims.anomaly.model.DetectorKind;
import com.reims.anomaly.model.TimeSeries;

/**
 * Interface for all detection methods in the ensemble.
 * Each implementation handles exactly one DetectorKind.
 */
public interface AnomalyDetector {

    /**
     * The detection method this detector implements.
     */
    DetectorKind getKind();

    /**
     * Run the detector over a single series.
     *
     * @param series  the observations for one (entity, field) pair
     * @param context run-scoped settings shared by all detectors
     * @return the run result; never null, "no anomalies" is an empty successful run
     */
    DetectionRun detect(TimeSeries series, DetectionContext context);
}
