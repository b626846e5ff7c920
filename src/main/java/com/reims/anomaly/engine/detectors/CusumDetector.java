package com.reims.anomaly.engine.detectors;

import com.reims.anomaly.config.DetectionConfig;
import com.reims.anomaly.engine.DetectionContext;
import com.reims.anomaly.engine.statistical.StatisticalDetector;
import com.reims.anomaly.model.AnomalyCandidate;
import com.reims.anomaly.model.DetectorKind;
import com.reims.anomaly.model.TimeSeries;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Sustained level shifts, e.g. a permanent step up in an expense line.
 */
@Component
public class CusumDetector extends AbstractStatisticalDetector {

    public CusumDetector(DetectionConfig config) {
        super(config);
    }

    @Override
    public DetectorKind getKind() {
        return DetectorKind.CUSUM;
    }

    @Override
    protected List<AnomalyCandidate> findCandidates(TimeSeries series, DetectionContext context) {
        return StatisticalDetector.detectCusum(series, config.getCusumThreshold(), config.getCusumDrift());
    }
}
