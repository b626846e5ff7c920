package com.reims.anomaly.engine.scoring;

import com.reims.anomaly.engine.model.OutlierModel;

/**
 * Scores a batch of feature vectors with a trained model. Backends differ only
 * in how the work is executed; results are element-wise identical.
 */
public interface ScoringBackend {

    String name();

    double[] scoreAll(OutlierModel model, double[][] points);
}
