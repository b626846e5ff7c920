package com.reims.anomaly.model;

import com.reims.anomaly.engine.Scores;
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
@Schema(description = "All candidates one detector produced for one (entity, field) invocation")
public class DetectionRun {

    @Schema(description = "Detection method", example = "z_score")
    private DetectorKind method;

    @Schema(description = "Overall confidence in this method's output for the series (0-1)", example = "0.7")
    private double methodConfidence;

    @Builder.Default
    private List<AnomalyCandidate> candidates = new ArrayList<>();

    @Schema(description = "False when the detector could not run (insufficient data, training failure)")
    private boolean success;

    @Schema(description = "Why the run produced what it did", example = "Insufficient data: need at least 3 points, got 2")
    private String reason;

    public static DetectionRun completed(DetectorKind method, double methodConfidence, List<AnomalyCandidate> candidates) {
        return DetectionRun.builder()
                .method(method)
                .methodConfidence(Scores.clamp01(methodConfidence))
                .candidates(new ArrayList<>(candidates))
                .success(true)
                .reason(candidates.isEmpty()
                        ? "No anomalies found"
                        : candidates.size() + " candidate(s) flagged")
                .build();
    }

    public static DetectionRun insufficientData(DetectorKind method, String reason) {
        return DetectionRun.builder()
                .method(method)
                .methodConfidence(0.0)
                .success(false)
                .reason(reason)
                .build();
    }

    public static DetectionRun failed(DetectorKind method, String reason) {
        return DetectionRun.builder()
                .method(method)
                .methodConfidence(0.0)
                .success(false)
                .reason(reason)
                .build();
    }
}
