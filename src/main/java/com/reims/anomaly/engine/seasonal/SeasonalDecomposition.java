package com.reims.anomaly.engine.seasonal;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Additive split of a series: observed = trend + seasonal + residual, point by point.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SeasonalDecomposition {

    public static final String METHOD_STL = "stl";
    public static final String METHOD_MOVING_AVERAGE = "moving_average";

    private double[] trend;
    private double[] seasonal;
    private double[] residual;
    private int period;
    private String method;

    public int size() {
        return trend == null ? 0 : trend.length;
    }

    public boolean hasSeasonality() {
        return METHOD_STL.equals(method);
    }
}
