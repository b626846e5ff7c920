package com.reims.anomaly.model;

import io.swagger.v3.oas.annotations.media.Schema;
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
@Schema(description = "Outcome of running the detection ensemble over one series")
public class EvaluationReport {

    @Schema(description = "Entity the series belongs to", example = "PROP-001")
    private String entityId;

    @Schema(description = "Account field", example = "operating_expenses")
    private String field;

    @Schema(description = "False only when no detector could run at all", example = "true")
    private boolean success;

    @Schema(description = "Summary of the outcome", example = "1 consensus anomaly (1 active, 0 suppressed)")
    private String reason;

    @Builder.Default
    private List<ConsensusAnomaly> anomalies = new ArrayList<>();

    @Builder.Default
    private List<DetectionRun> runs = new ArrayList<>();

    private int activeCount;
    private int suppressedCount;
    private double consensusRate;
    private long evaluatedAt;
}
