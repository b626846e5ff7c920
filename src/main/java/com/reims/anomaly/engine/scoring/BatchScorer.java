package com.reims.anomaly.engine.scoring;

import com.reims.anomaly.config.ModelTrainingConfig;
import com.reims.anomaly.engine.model.OutlierModel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Picks the parallel backend for large batches when enabled, and falls back to
 * the sequential backend if parallel scoring fails.
 */
@Component
public class BatchScorer {

    private static final Logger log = LoggerFactory.getLogger(BatchScorer.class);

    private final SequentialScoringBackend sequential;
    private final ParallelScoringBackend parallel;
    private final ModelTrainingConfig config;

    public BatchScorer(SequentialScoringBackend sequential, ParallelScoringBackend parallel,
                       ModelTrainingConfig config) {
        this.sequential = sequential;
        this.parallel = parallel;
        this.config = config;
    }

    public double[] scoreAll(OutlierModel model, double[][] points) {
        if (!config.isParallelScoring() || points.length < config.getParallelThreshold()) {
            return sequential.scoreAll(model, points);
        }
        try {
            return parallel.scoreAll(model, points);
        } catch (RuntimeException e) {
            log.warn("Parallel scoring of {} points with {} failed, retrying sequentially: {}",
                    points.length, model.kind(), e.getMessage());
            return sequential.scoreAll(model, points);
        }
    }
}
