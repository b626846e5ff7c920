package com.reims.anomaly.service;

import com.reims.anomaly.config.DetectionConfig;
import com.reims.anomaly.engine.Scores;
import com.reims.anomaly.model.AnomalyCandidate;
import com.reims.anomaly.model.AnomalyType;
import com.reims.anomaly.model.CombinationResult;
import com.reims.anomaly.model.ConsensusAnomaly;
import com.reims.anomaly.model.ConsensusState;
import com.reims.anomaly.model.DetectionRun;
import com.reims.anomaly.model.DetectorKind;
import com.reims.anomaly.model.VoteTally;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Reconciles the candidates of several detectors into consensus anomalies.
 *
 * Candidates are grouped by (field, anomaly type). A group becomes a consensus
 * anomaly when enough distinct methods voted for it and the weight-normalised
 * confidence of its votes clears the threshold:
 *
 *   weighted = sum(methodConfidence * candidateConfidence * weight) / sum(weight)
 */
@Service
public class EnsembleCombiner {

    private static final Logger log = LoggerFactory.getLogger(EnsembleCombiner.class);

    // Minimum summed weight for weightedVoting
    public static final double WEIGHTED_VOTE_THRESHOLD = 0.3;

    // Method confidence assumed by weightedVoting when the caller supplies none
    public static final double DEFAULT_METHOD_CONFIDENCE = 0.7;

    private final DetectorWeightRegistry weightRegistry;
    private final DetectionConfig config;

    public EnsembleCombiner(DetectorWeightRegistry weightRegistry, DetectionConfig config) {
        this.weightRegistry = weightRegistry;
        this.config = config;
    }

    public CombinationResult combineDetections(List<DetectionRun> runs) {
        return combineDetections(runs, config.getMinAgreementCount(), config.getEnsembleConfidenceThreshold());
    }

    /**
     * @param minAgreement        distinct methods a group needs
     * @param confidenceThreshold weighted confidence (0-1) a group needs
     * @return consensus anomalies sorted by descending ensemble confidence
     */
    public CombinationResult combineDetections(List<DetectionRun> runs, int minAgreement, double confidenceThreshold) {
        Set<DetectorKind> methodsUsed = new LinkedHashSet<>();
        Map<GroupKey, List<Vote>> groups = new LinkedHashMap<>();
        int totalDetections = 0;

        for (DetectionRun run : runs) {
            if (!run.isSuccess()) continue;
            methodsUsed.add(run.getMethod());
            for (AnomalyCandidate candidate : run.getCandidates()) {
                totalDetections++;
                groups.computeIfAbsent(new GroupKey(candidate.getField(), candidate.getAnomalyType()),
                                k -> new ArrayList<>())
                        .add(new Vote(run.getMethod(), run.getMethodConfidence(), candidate));
            }
        }

        List<ConsensusAnomaly> anomalies = new ArrayList<>();
        for (Map.Entry<GroupKey, List<Vote>> group : groups.entrySet()) {
            List<Vote> votes = group.getValue();
            Set<DetectorKind> methods = new LinkedHashSet<>();
            double weightedSum = 0.0;
            double weightTotal = 0.0;
            Vote best = null;

            for (Vote vote : votes) {
                methods.add(vote.method());
                double weight = weightRegistry.getWeight(vote.method());
                weightedSum += vote.methodConfidence() * vote.candidate().getConfidence() * weight;
                weightTotal += weight;
                if (best == null || vote.candidate().getConfidence() > best.candidate().getConfidence()) {
                    best = vote;
                }
            }

            double weighted = weightTotal > 0 ? weightedSum / weightTotal : 0.0;
            if (methods.size() < minAgreement || weighted < confidenceThreshold) {
                log.debug("Group {}/{} rejected: {} method(s), weighted confidence {}",
                        group.getKey().field(), group.getKey().type(), methods.size(), weighted);
                continue;
            }

            anomalies.add(ConsensusAnomaly.builder()
                    .field(group.getKey().field())
                    .anomalyType(group.getKey().type())
                    .representative(best.candidate())
                    .weightedConfidence(Scores.clamp01(weighted))
                    .ensembleConfidence(Scores.clamp0100(weighted * 100.0))
                    .methodsAgreed(methods.size())
                    .detectionMethods(methods)
                    .consensus(true)
                    .state(ConsensusState.CONSENSUS)
                    .build());
        }

        anomalies.sort(Comparator.comparingDouble(ConsensusAnomaly::getEnsembleConfidence).reversed());

        return CombinationResult.builder()
                .anomalies(anomalies)
                .methodsUsed(methodsUsed)
                .consensusCount(anomalies.size())
                .totalDetections(totalDetections)
                .consensusRate(anomalies.size() / (double) Math.max(1, totalDetections))
                .build();
    }

    /**
     * Keeps groups whose summed method weight, scaled by each method's
     * confidence ({@link #DEFAULT_METHOD_CONFIDENCE} when absent), reaches
     * {@link #WEIGHTED_VOTE_THRESHOLD}.
     */
    public List<VoteTally> weightedVoting(Map<DetectorKind, List<AnomalyCandidate>> candidatesByMethod,
                                          Map<DetectorKind, Double> methodConfidences) {
        List<VoteTally> tallies = tally(candidatesByMethod);
        List<VoteTally> accepted = new ArrayList<>();
        for (VoteTally tally : tallies) {
            double weight = 0.0;
            for (DetectorKind method : tally.getVotingMethods()) {
                double confidence = methodConfidences != null
                        ? methodConfidences.getOrDefault(method, DEFAULT_METHOD_CONFIDENCE)
                        : DEFAULT_METHOD_CONFIDENCE;
                weight += weightRegistry.getWeight(method) * confidence;
            }
            tally.setEnsembleWeight(weight);
            if (weight >= WEIGHTED_VOTE_THRESHOLD) {
                accepted.add(tally);
            }
        }
        accepted.sort(Comparator.comparingDouble(VoteTally::getEnsembleWeight).reversed());
        return accepted;
    }

    /**
     * Keeps groups flagged by strictly more than half of the methods present.
     */
    public List<VoteTally> majorityVoting(Map<DetectorKind, List<AnomalyCandidate>> candidatesByMethod) {
        int required = candidatesByMethod.size() / 2 + 1;
        List<VoteTally> accepted = new ArrayList<>();
        for (VoteTally tally : tally(candidatesByMethod)) {
            if (tally.getVoteCount() >= required) {
                accepted.add(tally);
            }
        }
        accepted.sort(Comparator.comparingInt(VoteTally::getVoteCount).reversed());
        return accepted;
    }

    private List<VoteTally> tally(Map<DetectorKind, List<AnomalyCandidate>> candidatesByMethod) {
        Map<GroupKey, VoteTally> tallies = new LinkedHashMap<>();
        candidatesByMethod.forEach((method, candidates) -> {
            if (candidates == null) return;
            for (AnomalyCandidate candidate : candidates) {
                GroupKey key = new GroupKey(candidate.getField(), candidate.getAnomalyType());
                VoteTally tally = tallies.computeIfAbsent(key, k -> VoteTally.builder()
                        .field(k.field())
                        .anomalyType(k.type())
                        .build());
                if (!tally.getVotingMethods().contains(method)) {
                    tally.getVotingMethods().add(method);
                    tally.setVoteCount(tally.getVotingMethods().size());
                }
                if (tally.getRepresentative() == null
                        || candidate.getConfidence() > tally.getRepresentative().getConfidence()) {
                    tally.setRepresentative(candidate);
                }
            }
        });
        return new ArrayList<>(tallies.values());
    }

    private record GroupKey(String field, AnomalyType type) {}

    private record Vote(DetectorKind method, double methodConfidence, AnomalyCandidate candidate) {}
}
