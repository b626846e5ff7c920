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
@Schema(description = "Materiality of a consensus anomaly")
public class ImpactAssessment {

    @Schema(description = "|actual - expected| in dollars", example = "5000.0")
    private double absoluteVariance;

    @Schema(description = "Variance as a percentage of the parent category total", example = "5.0")
    private double parentCategoryImpactPct;

    @Schema(description = "Parent category total, 0 when unknown", example = "100000.0")
    private double parentTotal;

    private DscrProximity dscr;

    @Schema(description = "Variance component of the score (0-40)", example = "20.0")
    private double varianceComponent;

    @Schema(description = "Parent category component of the score (0-30)", example = "15.0")
    private double categoryComponent;

    @Schema(description = "DSCR component of the score (0-40)", example = "30.0")
    private double dscrComponent;

    @Schema(description = "Combined impact score (0-100)", example = "65.0")
    private double impactScore;
}
