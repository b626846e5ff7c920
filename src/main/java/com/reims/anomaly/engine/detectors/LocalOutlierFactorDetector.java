package com.reims.anomaly.engine.detectors;

import com.reims.anomaly.config.DetectionConfig;
import com.reims.anomaly.config.ModelTrainingConfig;
import com.reims.anomaly.engine.Scores;
import com.reims.anomaly.engine.density.LocalOutlierFactor;
import com.reims.anomaly.engine.isolationforest.FeatureExtractor;
import com.reims.anomaly.engine.scoring.BatchScorer;
import com.reims.anomaly.model.DetectorKind;
import com.reims.anomaly.model.Severity;
import com.reims.anomaly.service.ModelCacheService;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Point outliers by local density. LOF near 1.0 is normal; above the threshold
 * (default 1.5) the point sits in a markedly sparser region than its neighbours.
 */
@Component
public class LocalOutlierFactorDetector extends AbstractModelDetector<LocalOutlierFactor> {

    public LocalOutlierFactorDetector(ModelCacheService modelCacheService, BatchScorer batchScorer,
                                      ModelTrainingConfig trainingConfig, DetectionConfig detectionConfig) {
        super(modelCacheService, batchScorer, trainingConfig, detectionConfig);
    }

    @Override
    public DetectorKind getKind() {
        return DetectorKind.LOCAL_OUTLIER_FACTOR;
    }

    @Override
    protected Class<LocalOutlierFactor> modelClass() {
        return LocalOutlierFactor.class;
    }

    @Override
    protected LocalOutlierFactor train(double[][] features) {
        return LocalOutlierFactor.train(features, trainingConfig.getLof().getNeighbors());
    }

    @Override
    protected Map<String, Object> trainingParameters() {
        Map<String, Object> params = new LinkedHashMap<>();
        params.put("neighbors", trainingConfig.getLof().getNeighbors());
        params.put("features", FeatureExtractor.FEATURE_COUNT);
        return params;
    }

    @Override
    protected boolean isOutlier(double score) {
        return score > trainingConfig.getLof().getScoreThreshold();
    }

    // saturates at twice the threshold
    @Override
    protected double candidateConfidence(double score) {
        double threshold = trainingConfig.getLof().getScoreThreshold();
        return Scores.confidenceFromMagnitude(score - threshold, threshold);
    }

    @Override
    protected Severity severity(double score) {
        return score > 2 * trainingConfig.getLof().getScoreThreshold() ? Severity.HIGH : Severity.MEDIUM;
    }
}
