package com.reims.anomaly.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "A single periodic observation of a financial account")
public class TimeSeriesPoint {

    @Schema(description = "Period identifier, unique within a series", example = "2024-03")
    private String periodKey;

    @Schema(description = "Observed value for the period", example = "48250.00")
    private double value;

    @Schema(description = "Period end date, used for seasonal alignment", example = "2024-03-31")
    private LocalDate date;
}
