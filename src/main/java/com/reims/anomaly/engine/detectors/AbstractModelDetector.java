package com.reims.anomaly.engine.detectors;

import com.reims.anomaly.config.DetectionConfig;
import com.reims.anomaly.config.ModelTrainingConfig;
import com.reims.anomaly.engine.AnomalyDetector;
import com.reims.anomaly.engine.DetectionContext;
import com.reims.anomaly.engine.Scores;
import com.reims.anomaly.engine.isolationforest.FeatureExtractor;
import com.reims.anomaly.engine.model.OutlierModel;
import com.reims.anomaly.engine.scoring.BatchScorer;
import com.reims.anomaly.engine.statistical.SeriesStats;
import com.reims.anomaly.exception.ModelTrainingException;
import com.reims.anomaly.model.AnomalyCandidate;
import com.reims.anomaly.model.AnomalyType;
import com.reims.anomaly.model.CacheLookup;
import com.reims.anomaly.model.DetectionRun;
import com.reims.anomaly.model.ModelScope;
import com.reims.anomaly.model.Severity;
import com.reims.anomaly.model.StatisticType;
import com.reims.anomaly.model.TimeSeries;
import com.reims.anomaly.model.TimeSeriesPoint;
import com.reims.anomaly.service.ModelCacheService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Base for detectors backed by a trained model. The model is trained on the
 * series' own feature vectors (scoped to entity and field), fetched through the
 * model cache, and every observation is scored. A training failure excludes
 * this detector from the run.
 */
public abstract class AbstractModelDetector<M extends OutlierModel> implements AnomalyDetector {

    private static final Logger log = LoggerFactory.getLogger(AbstractModelDetector.class);

    protected final ModelCacheService modelCacheService;
    protected final BatchScorer batchScorer;
    protected final ModelTrainingConfig trainingConfig;
    protected final DetectionConfig detectionConfig;

    protected AbstractModelDetector(ModelCacheService modelCacheService, BatchScorer batchScorer,
                                    ModelTrainingConfig trainingConfig, DetectionConfig detectionConfig) {
        this.modelCacheService = modelCacheService;
        this.batchScorer = batchScorer;
        this.trainingConfig = trainingConfig;
        this.detectionConfig = detectionConfig;
    }

    protected abstract Class<M> modelClass();

    /** Trains a fresh model on the feature matrix. */
    protected abstract M train(double[][] features);

    /** Training parameters; part of the cache key. */
    protected abstract Map<String, Object> trainingParameters();

    protected abstract boolean isOutlier(double score);

    protected abstract double candidateConfidence(double score);

    protected abstract Severity severity(double score);

    @Override
    public DetectionRun detect(TimeSeries series, DetectionContext context) {
        int minPoints = trainingConfig.getMinTrainingPoints();
        if (series.size() < minPoints) {
            return DetectionRun.insufficientData(getKind(), String.format(
                    "Insufficient data: need at least %d points, got %d", minPoints, series.size()));
        }

        double[] values = series.values();
        double[][] features = FeatureExtractor.extract(values);

        M model;
        boolean cacheHit = false;
        try {
            if (context.isUseModelCache()) {
                CacheLookup<M> lookup = modelCacheService.getOrTrain(
                        ModelScope.of(context.getEntityId(), series.getField()),
                        getKind().getCode(),
                        modelClass(),
                        () -> train(features),
                        trainingParameters(),
                        series.size());
                model = lookup.model();
                cacheHit = lookup.cacheHit();
            } else {
                model = train(features);
            }
        } catch (ModelTrainingException e) {
            log.warn("{} training failed for {}/{}: {}",
                    getKind().getCode(), context.getEntityId(), series.getField(), e.getMessage());
            return DetectionRun.failed(getKind(), "Model training failed: " + e.getMessage());
        }

        double[] scores = batchScorer.scoreAll(model, features);
        double median = SeriesStats.median(values);

        List<AnomalyCandidate> candidates = new ArrayList<>();
        for (int i = 0; i < scores.length; i++) {
            if (!isOutlier(scores[i])) continue;

            TimeSeriesPoint point = series.get(i);
            candidates.add(AnomalyCandidate.builder()
                    .field(series.getField())
                    .anomalyType(AnomalyType.POINT_OUTLIER)
                    .method(getKind())
                    .severity(severity(scores[i]))
                    .periodKey(point.getPeriodKey())
                    .index(i)
                    .value(point.getValue())
                    .expectedValue(median)
                    .statistic(scores[i])
                    .statisticType(StatisticType.MODEL_SCORE)
                    .confidence(Scores.clamp01(candidateConfidence(scores[i])))
                    .direction(point.getValue() >= median ? "above" : "below")
                    .reason(describe(model, features[i], scores[i]))
                    .build());
        }

        log.debug("{} scored {} points for {}/{} (cache {}), {} flagged",
                getKind().getCode(), scores.length, context.getEntityId(), series.getField(),
                cacheHit ? "hit" : "miss", candidates.size());
        return DetectionRun.completed(getKind(), detectionConfig.methodConfidenceFor(getKind()), candidates);
    }

    protected String describe(M model, double[] features, double score) {
        return String.format("%s score=%.3f", getKind().getCode(), score);
    }
}
