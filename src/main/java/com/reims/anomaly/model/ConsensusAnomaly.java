package com.reims.anomaly.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashSet;
import java.util.Set;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "A finding corroborated by multiple detectors, keyed by (field, anomaly type)")
public class ConsensusAnomaly {

    @Schema(description = "Entity (property, account holder) the series belongs to", example = "PROP-001")
    private String entityId;

    @Schema(description = "Account field", example = "operating_expenses")
    private String field;

    @Schema(description = "Shape of the deviation", example = "percentage_change")
    private AnomalyType anomalyType;

    @Schema(description = "Highest-confidence vote of the group")
    private AnomalyCandidate representative;

    @Schema(description = "Weighted ensemble confidence (0-1) compared against the confidence threshold", example = "0.84")
    private double weightedConfidence;

    @Schema(description = "Ensemble confidence on a 0-100 scale", example = "84.0")
    private double ensembleConfidence;

    @Schema(description = "Number of distinct methods that flagged this group", example = "2")
    private int methodsAgreed;

    @Builder.Default
    private Set<DetectorKind> detectionMethods = new LinkedHashSet<>();

    @Schema(description = "True when agreement and confidence thresholds were both met", example = "true")
    private boolean consensus;

    @Schema(description = "True when excluded from downstream action by noise suppression", example = "false")
    private boolean suppressed;

    @Schema(description = "Why the anomaly was suppressed")
    private String suppressionReason;

    @Builder.Default
    private ConsensusState state = ConsensusState.CANDIDATE;

    private DetectorAgreement agreement;

    private ImpactAssessment impact;

    /** Dollar impact used by the materiality floor; null until impact is assessed. */
    public Double impactAmount() {
        return impact != null ? impact.getAbsoluteVariance() : null;
    }

    /** Confidence of the representative vote, 0 when there is none. */
    public double representativeConfidence() {
        return representative != null ? representative.getConfidence() : 0.0;
    }
}
