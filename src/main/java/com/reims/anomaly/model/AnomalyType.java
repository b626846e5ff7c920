package com.reims.anomaly.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Shape of deviation a candidate describes. Detectors that describe the same
 * shape on the same field corroborate each other in the ensemble.
 */
public enum AnomalyType {
    POINT_OUTLIER("point_outlier"),
    PERCENTAGE_CHANGE("percentage_change"),
    LEVEL_SHIFT("level_shift"),
    VOLATILITY_SPIKE("volatility_spike");

    private final String code;

    AnomalyType(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }
}
