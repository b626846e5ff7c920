package com.reims.anomaly.engine.detectors;

import com.reims.anomaly.config.DetectionConfig;
import com.reims.anomaly.config.ModelTrainingConfig;
import com.reims.anomaly.engine.isolationforest.FeatureExtractor;
import com.reims.anomaly.engine.isolationforest.IsolationForest;
import com.reims.anomaly.engine.scoring.BatchScorer;
import com.reims.anomaly.model.DetectorKind;
import com.reims.anomaly.model.Severity;
import com.reims.anomaly.service.ModelCacheService;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Point outliers by Isolation Forest over level, change and local-deviation features.
 *
 * Scoring:
 *   Score ranges from 0.0 (normal) to 1.0 (anomalous); ~0.5 is uncertain.
 *   Points above the configured threshold (default 0.6) are flagged.
 *   Confidence scales from 0.6 at the threshold to 0.95 at score 1.0.
 */
@Component
public class IsolationForestDetector extends AbstractModelDetector<IsolationForest> {

    public IsolationForestDetector(ModelCacheService modelCacheService, BatchScorer batchScorer,
                                   ModelTrainingConfig trainingConfig, DetectionConfig detectionConfig) {
        super(modelCacheService, batchScorer, trainingConfig, detectionConfig);
    }

    @Override
    public DetectorKind getKind() {
        return DetectorKind.ISOLATION_FOREST;
    }

    @Override
    protected Class<IsolationForest> modelClass() {
        return IsolationForest.class;
    }

    @Override
    protected IsolationForest train(double[][] features) {
        ModelTrainingConfig.IsolationForestSettings settings = trainingConfig.getIsolationForest();
        return IsolationForest.train(features, settings.getNumTrees(), settings.getSampleSize(), settings.getSeed());
    }

    @Override
    protected Map<String, Object> trainingParameters() {
        ModelTrainingConfig.IsolationForestSettings settings = trainingConfig.getIsolationForest();
        Map<String, Object> params = new LinkedHashMap<>();
        params.put("numTrees", settings.getNumTrees());
        params.put("sampleSize", settings.getSampleSize());
        params.put("seed", settings.getSeed());
        params.put("features", FeatureExtractor.FEATURE_COUNT);
        return params;
    }

    @Override
    protected boolean isOutlier(double score) {
        return score > trainingConfig.getIsolationForest().getScoreThreshold();
    }

    @Override
    protected double candidateConfidence(double score) {
        double threshold = trainingConfig.getIsolationForest().getScoreThreshold();
        double range = 1.0 - threshold;
        double ratio = range > 0 ? Math.min(1.0, (score - threshold) / range) : 1.0;
        return 0.6 + 0.35 * ratio;
    }

    @Override
    protected Severity severity(double score) {
        return score > 0.75 ? Severity.HIGH : Severity.MEDIUM;
    }

    @Override
    protected String describe(IsolationForest forest, double[] features, double score) {
        double[] contributions = forest.featureContributions(features, FeatureExtractor.TYPICAL);
        int top = 0;
        for (int i = 1; i < contributions.length; i++) {
            if (contributions[i] > contributions[top]) top = i;
        }
        return String.format("Isolation Forest: score=%.3f (threshold=%.2f). Top factor: %s=%.2f",
                score, trainingConfig.getIsolationForest().getScoreThreshold(),
                FeatureExtractor.FEATURE_NAMES[top], features[top]);
    }
}
