package com.reims.anomaly.engine.model;

import com.reims.anomaly.model.DetectorKind;

/**
 * A trained scorer. Higher scores mean more anomalous; the scale is
 * model-specific. Implementations are immutable after training and safe to
 * score from several threads.
 */
public interface OutlierModel {

    DetectorKind kind();

    double score(double[] point);
}
