package com.reims.anomaly.engine.detectors;

import com.reims.anomaly.config.DetectionConfig;
import com.reims.anomaly.engine.DetectionContext;
import com.reims.anomaly.engine.statistical.StatisticalDetector;
import com.reims.anomaly.model.AnomalyCandidate;
import com.reims.anomaly.model.DetectorKind;
import com.reims.anomaly.model.TimeSeries;
import org.springframework.stereotype.Component;

import java.util.List;

@Component
public class ZScoreDetector extends AbstractStatisticalDetector {

    public ZScoreDetector(DetectionConfig config) {
        super(config);
    }

    @Override
    public DetectorKind getKind() {
        return DetectorKind.Z_SCORE;
    }

    @Override
    protected List<AnomalyCandidate> findCandidates(TimeSeries series, DetectionContext context) {
        return StatisticalDetector.detectZScore(series, config.getZscoreThreshold());
    }
}
