package com.reims.anomaly.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Data
@Configuration
@ConfigurationProperties(prefix = "anomaly.models")
public class ModelTrainingConfig {

    // Below this many points model-based detectors do not train
    private int minTrainingPoints = 8;

    // Score batches larger than this on the ForkJoin pool
    private boolean parallelScoring = true;
    private int parallelThreshold = 64;

    private IsolationForestSettings isolationForest = new IsolationForestSettings();

    private LocalOutlierFactorSettings lof = new LocalOutlierFactorSettings();

    @Data
    public static class IsolationForestSettings {
        private int numTrees = 100;
        private int sampleSize = 256;
        // Anomaly score (0-1) above which a point is flagged
        private double scoreThreshold = 0.6;
        // Fixed seed keeps training reproducible for identical input
        private long seed = 42L;
    }

    @Data
    public static class LocalOutlierFactorSettings {
        private int neighbors = 5;
        // LOF above which a point is flagged; ~1.0 means same density as neighbours
        private double scoreThreshold = 1.5;
    }
}
