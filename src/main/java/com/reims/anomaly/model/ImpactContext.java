package com.reims.anomaly.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Financial figures the caller supplies for impact scoring. Every field is optional.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Financial context used to score the materiality of findings")
public class ImpactContext {

    @Schema(description = "Total of the parent category for the period", example = "100000.0")
    private Double parentTotal;

    @Schema(description = "Current DSCR. Derived from NOI and debt service when absent", example = "1.20")
    private Double currentDscr;

    @Schema(description = "Net operating income for the period", example = "600000.0")
    private Double netOperatingIncome;

    @Schema(description = "Annual debt service", example = "500000.0")
    private Double annualDebtService;

    @Schema(description = "Covenant threshold override", example = "1.25")
    private Double covenantThreshold;
}
