package com.reims.anomaly.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AccuracyMetrics {
    private Double accuracy;
    private Double precision;
    private Double recall;
    private Double f1;
}
