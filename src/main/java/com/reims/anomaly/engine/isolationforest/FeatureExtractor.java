package com.reims.anomaly.engine.isolationforest;

import com.reims.anomaly.engine.statistical.SeriesStats;

/**
 * Turns each observation of a series into a 3-dimensional feature vector for
 * the model-based detectors.
 *
 * Features:
 *   [0] Level z-score: (value - series mean) / series stdev
 *   [1] Period change: (value - previous) / |previous|, clipped to [-10, 10]
 *   [2] Local deviation: (value - mean of up to 3 preceding values) / series stdev
 */
public class FeatureExtractor {

    public static final int FEATURE_COUNT = 3;

    public static final String[] FEATURE_NAMES = {
            "Level Z-score",
            "Period Change",
            "Local Deviation"
    };

    // A normal observation sits at the mean and moves with its neighbours
    public static final double[] TYPICAL = {0.0, 0.0, 0.0};

    private static final int LOCAL_WINDOW = 3;
    private static final double MAX_CHANGE = 10.0;

    private FeatureExtractor() {
    }

    public static double[][] extract(double[] values) {
        int n = values.length;
        double[][] features = new double[n][FEATURE_COUNT];
        double mean = SeriesStats.mean(values);
        double stdev = SeriesStats.sampleStdDev(values);

        for (int i = 0; i < n; i++) {
            // [0] Level z-score
            features[i][0] = stdev > 0 ? (values[i] - mean) / stdev : 0.0;

            // [1] Period change
            if (i > 0 && values[i - 1] != 0.0) {
                double change = (values[i] - values[i - 1]) / Math.abs(values[i - 1]);
                features[i][1] = Math.max(-MAX_CHANGE, Math.min(MAX_CHANGE, change));
            }

            // [2] Local deviation
            if (i > 0 && stdev > 0) {
                int from = Math.max(0, i - LOCAL_WINDOW);
                features[i][2] = (values[i] - SeriesStats.mean(values, from, i)) / stdev;
            }
        }
        return features;
    }
}
