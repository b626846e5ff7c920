package com.reims.anomaly.dto;

import com.reims.anomaly.model.ImpactContext;
import com.reims.anomaly.model.TimeSeries;
import com.reims.anomaly.model.TimeSeriesPoint;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "A series to evaluate, with optional financial context for impact scoring")
public class EvaluationRequest {

    @NotBlank
    @Schema(description = "Entity the series belongs to", example = "PROP-001", requiredMode = Schema.RequiredMode.REQUIRED)
    private String entityId;

    @NotBlank
    @Schema(description = "Account field", example = "operating_expenses", requiredMode = Schema.RequiredMode.REQUIRED)
    private String field;

    @NotNull
    @Builder.Default
    @Schema(description = "Observations in chronological order")
    private List<TimeSeriesPoint> points = new ArrayList<>();

    private ImpactContext impactContext;

    @Builder.Default
    @Schema(description = "Include the seasonal component in expected values", example = "true")
    private boolean useSeasonality = true;

    @Builder.Default
    @Schema(description = "Reuse cached trained models", example = "true")
    private boolean useModelCache = true;

    /** @throws IllegalArgumentException on duplicate period keys */
    public TimeSeries toSeries() {
        return TimeSeries.of(entityId, field, points);
    }
}
