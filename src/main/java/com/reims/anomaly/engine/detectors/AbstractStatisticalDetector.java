package com.reims.anomaly.engine.detectors;

import com.reims.anomaly.config.DetectionConfig;
import com.reims.anomaly.engine.AnomalyDetector;
import com.reims.anomaly.engine.DetectionContext;
import com.reims.anomaly.exception.InsufficientDataException;
import com.reims.anomaly.model.AnomalyCandidate;
import com.reims.anomaly.model.DetectionRun;
import com.reims.anomaly.model.TimeSeries;

import java.util.List;

/**
 * Base for detectors that are a pure function of the series. Runs carry the
 * method's configured confidence; a series that is too short yields an
 * unsuccessful run with no candidates.
 */
public abstract class AbstractStatisticalDetector implements AnomalyDetector {

    protected final DetectionConfig config;

    protected AbstractStatisticalDetector(DetectionConfig config) {
        this.config = config;
    }

    @Override
    public DetectionRun detect(TimeSeries series, DetectionContext context) {
        try {
            List<AnomalyCandidate> candidates = findCandidates(series, context);
            return DetectionRun.completed(getKind(), config.methodConfidenceFor(getKind()), candidates);
        } catch (InsufficientDataException e) {
            return DetectionRun.insufficientData(getKind(), e.getMessage());
        }
    }

    protected abstract List<AnomalyCandidate> findCandidates(TimeSeries series, DetectionContext context);
}
