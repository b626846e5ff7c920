package com.reims.anomaly.service;

import com.reims.anomaly.config.DetectionConfig;
import com.reims.anomaly.model.ConsensusAnomaly;
import com.reims.anomaly.model.ConsensusState;
import com.reims.anomaly.model.DetectorAgreement;
import com.reims.anomaly.model.DetectorKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Decides which consensus anomalies reach reviewers. Any single weak signal
 * suppresses: low agreement, low agreement share, immaterial dollar impact,
 * or low confidence. Suppression only flags the anomaly.
 */
@Service
public class NoiseSuppressionService {

    private static final Logger log = LoggerFactory.getLogger(NoiseSuppressionService.class);

    private final DetectionConfig config;
    private final DetectorWeightRegistry weightRegistry;

    public NoiseSuppressionService(DetectionConfig config, DetectorWeightRegistry weightRegistry) {
        this.config = config;
        this.weightRegistry = weightRegistry;
    }

    /**
     * Cross-method corroboration for one anomaly: the union of its own methods and
     * those of every other anomaly on the same (entity, field). The share is taken
     * against that union, never against detectors that merely ran without flagging.
     *
     * @param detectorsRun methods that ran successfully on the series; listed in the
     *                     details as unflagged when they did not corroborate
     */
    public DetectorAgreement detectorAgreement(ConsensusAnomaly anomaly, Collection<ConsensusAnomaly> peers,
                                               Collection<DetectorKind> detectorsRun) {
        Set<DetectorKind> agreeing = new LinkedHashSet<>(anomaly.getDetectionMethods());
        if (peers != null) {
            for (ConsensusAnomaly peer : peers) {
                if (peer == anomaly) continue;
                if (Objects.equals(peer.getEntityId(), anomaly.getEntityId())
                        && Objects.equals(peer.getField(), anomaly.getField())) {
                    agreeing.addAll(peer.getDetectionMethods());
                }
            }
        }

        Set<DetectorKind> listed = new LinkedHashSet<>(agreeing);
        if (detectorsRun != null) {
            listed.addAll(detectorsRun);
        }

        List<DetectorAgreement.DetectorDetail> details = new ArrayList<>();
        for (DetectorKind kind : listed) {
            details.add(DetectorAgreement.DetectorDetail.builder()
                    .method(kind)
                    .weight(weightRegistry.getWeight(kind))
                    .flagged(agreeing.contains(kind))
                    .build());
        }

        int total = Math.max(anomaly.getDetectionMethods().size(), agreeing.size());
        return DetectorAgreement.builder()
                .agreementCount(agreeing.size())
                .totalDetectors(total)
                .agreementPercent(total > 0 ? agreeing.size() / (double) total : 0.0)
                .detectorDetails(details)
                .build();
    }

    /**
     * Applies the suppression rules and records the outcome on the anomaly.
     * Depends only on the anomaly's agreement, impact and confidence, so repeated
     * calls give the same state and reason.
     *
     * @return true when suppressed
     */
    public boolean suppressNoise(ConsensusAnomaly anomaly) {
        DetectorAgreement agreement = anomaly.getAgreement();
        int agreementCount = agreement != null ? agreement.getAgreementCount() : anomaly.getMethodsAgreed();
        double agreementPercent = agreement != null ? agreement.getAgreementPercent() : 1.0;
        Double impactAmount = anomaly.impactAmount();
        double confidence = anomaly.representativeConfidence();

        List<String> reasons = new ArrayList<>();
        if (agreementCount < config.getMinAgreementCount()) {
            reasons.add(String.format("Only %d detector(s) agree (minimum %d)",
                    agreementCount, config.getMinAgreementCount()));
        }
        if (agreementPercent < config.getMinAgreementThreshold()) {
            reasons.add(String.format("Detector agreement %.0f%% below %.0f%%",
                    agreementPercent * 100, config.getMinAgreementThreshold() * 100));
        }
        if (impactAmount != null && Math.abs(impactAmount) < config.getMaterialityFloor()) {
            reasons.add(String.format("Impact $%.2f below materiality floor $%.2f",
                    Math.abs(impactAmount), config.getMaterialityFloor()));
        }
        if (confidence < config.getConfidenceSuppressionFloor()) {
            reasons.add(String.format("Confidence %.2f below %.2f",
                    confidence, config.getConfidenceSuppressionFloor()));
        }

        boolean suppressed = !reasons.isEmpty();
        anomaly.setSuppressed(suppressed);
        anomaly.setSuppressionReason(suppressed ? String.join("; ", reasons) : null);
        anomaly.setState(suppressed ? ConsensusState.SUPPRESSED : ConsensusState.ACTIVE);

        if (suppressed) {
            log.debug("Suppressed {}/{} {}: {}", anomaly.getEntityId(), anomaly.getField(),
                    anomaly.getAnomalyType(), anomaly.getSuppressionReason());
        }
        return suppressed;
    }

    /**
     * Computes agreement for every anomaly against the others, then suppresses.
     */
    public int suppressAll(List<ConsensusAnomaly> anomalies, Collection<DetectorKind> detectorsRun) {
        for (ConsensusAnomaly anomaly : anomalies) {
            anomaly.setAgreement(detectorAgreement(anomaly, anomalies, detectorsRun));
        }
        int suppressed = 0;
        for (ConsensusAnomaly anomaly : anomalies) {
            if (suppressNoise(anomaly)) suppressed++;
        }
        return suppressed;
    }
}
