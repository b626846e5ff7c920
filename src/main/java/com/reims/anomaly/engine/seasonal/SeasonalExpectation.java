package com.reims.anomaly.engine.seasonal;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SeasonalExpectation {
    private double expectedValue;
    private double trendValue;
    private double seasonalComponent;
    // grows with history length, 0.3 below 3 points
    private double confidence;
    private String method;
}
