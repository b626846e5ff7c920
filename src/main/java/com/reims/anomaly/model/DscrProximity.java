package com.reims.anomaly.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Debt service coverage proximity to the loan covenant")
public class DscrProximity {

    @Schema(description = "Current DSCR, null when unknown", example = "1.20")
    private Double currentDscr;

    @Schema(description = "Covenant threshold used", example = "1.25")
    private double threshold;

    @Schema(description = "currentDscr - threshold, null when DSCR unknown", example = "-0.05")
    private Double distanceToThreshold;

    @Schema(description = "True when within 0.1 of (or below) the covenant", example = "true")
    private boolean breachRisk;

    @Schema(description = "Variance as a fraction of annual debt service", example = "0.02")
    private double dscrImpact;
}
