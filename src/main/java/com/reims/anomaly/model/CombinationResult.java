package com.reims.anomaly.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CombinationResult {

    @Builder.Default
    private List<ConsensusAnomaly> anomalies = new ArrayList<>();

    @Builder.Default
    private Set<DetectorKind> methodsUsed = new LinkedHashSet<>();

    private int consensusCount;
    private int totalDetections;

    // consensusCount / max(1, totalDetections)
    private double consensusRate;
}
