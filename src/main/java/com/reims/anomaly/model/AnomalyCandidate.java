package com.reims.anomaly.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "A single finding emitted by one detector for one series")
public class AnomalyCandidate {

    @Schema(description = "Account field the series belongs to", example = "operating_expenses")
    private String field;

    @Schema(description = "Shape of the deviation", example = "point_outlier")
    private AnomalyType anomalyType;

    @Schema(description = "Detector that produced this candidate", example = "z_score")
    private DetectorKind method;

    @Schema(description = "Detector-assigned severity", example = "HIGH")
    private Severity severity;

    @Schema(description = "Period key of the flagged point", example = "2024-05")
    private String periodKey;

    @Schema(description = "Index of the flagged point within the series", example = "4")
    private int index;

    @Schema(description = "Observed value", example = "1000.0")
    private double value;

    @Schema(description = "Value the detector expected at this point", example = "100.0")
    private double expectedValue;

    @Schema(description = "Detector statistic (z-score, CUSUM magnitude, signed % change, ...)", example = "569.2")
    private double statistic;

    @Schema(description = "Which statistic the statistic field carries", example = "Z_SCORE")
    private StatisticType statisticType;

    @Schema(description = "Detector confidence in this finding (0-1)", example = "0.95")
    private double confidence;

    @Schema(description = "Direction of the deviation", example = "above")
    private String direction;

    @Schema(description = "Human-readable explanation")
    private String reason;
}
