package com.reims.anomaly.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Output of the simpler voting strategies: one entry per (field, anomaly type)
 * that cleared the vote.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class VoteTally {

    private String field;
    private AnomalyType anomalyType;
    private AnomalyCandidate representative;
    private int voteCount;

    @Builder.Default
    private List<DetectorKind> votingMethods = new ArrayList<>();

    // sum of weight x method confidence; 0 for majority voting
    private double ensembleWeight;
}
