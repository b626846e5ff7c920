package com.reims.anomaly.service;

import com.reims.anomaly.config.MetricsConfig;
import com.reims.anomaly.engine.DetectionContext;
import com.reims.anomaly.engine.DetectionEngine;
import com.reims.anomaly.model.CombinationResult;
import com.reims.anomaly.model.ConsensusAnomaly;
import com.reims.anomaly.model.DetectionRun;
import com.reims.anomaly.model.DetectorKind;
import com.reims.anomaly.model.EvaluationReport;
import com.reims.anomaly.model.ImpactContext;
import com.reims.anomaly.model.TimeSeries;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Orchestrates the ensemble for one series:
 *   1. Run every detector
 *   2. Combine candidates into consensus anomalies
 *   3. Attach impact assessments
 *   4. Apply noise suppression (ACTIVE or SUPPRESSED)
 */
@Service
public class SeriesEvaluationService {

    private static final Logger log = LoggerFactory.getLogger(SeriesEvaluationService.class);

    private final DetectionEngine detectionEngine;
    private final EnsembleCombiner ensembleCombiner;
    private final ImpactCalculator impactCalculator;
    private final NoiseSuppressionService noiseSuppressionService;
    private final MetricsConfig metricsConfig;
    private final Clock clock;

    public SeriesEvaluationService(DetectionEngine detectionEngine,
                                   EnsembleCombiner ensembleCombiner,
                                   ImpactCalculator impactCalculator,
                                   NoiseSuppressionService noiseSuppressionService,
                                   MetricsConfig metricsConfig,
                                   Clock clock) {
        this.detectionEngine = detectionEngine;
        this.ensembleCombiner = ensembleCombiner;
        this.impactCalculator = impactCalculator;
        this.noiseSuppressionService = noiseSuppressionService;
        this.metricsConfig = metricsConfig;
        this.clock = clock;
    }

    public EvaluationReport evaluate(TimeSeries series, ImpactContext impactContext) {
        return evaluate(series, impactContext, DetectionContext.builder().entityId(series.getEntityId()).build());
    }

    public EvaluationReport evaluate(TimeSeries series, ImpactContext impactContext, DetectionContext context) {
        List<DetectionRun> runs = detectionEngine.runAll(series, context);

        Set<DetectorKind> detectorsRun = new LinkedHashSet<>();
        for (DetectionRun run : runs) {
            if (run.isSuccess()) detectorsRun.add(run.getMethod());
        }

        if (detectorsRun.isEmpty()) {
            log.info("No detector could evaluate {}/{} ({} points)",
                    series.getEntityId(), series.getField(), series.size());
            return EvaluationReport.builder()
                    .entityId(series.getEntityId())
                    .field(series.getField())
                    .success(false)
                    .reason(String.format("No detector could evaluate %d point(s)", series.size()))
                    .runs(runs)
                    .evaluatedAt(clock.millis())
                    .build();
        }

        CombinationResult combination = ensembleCombiner.combineDetections(runs);
        List<ConsensusAnomaly> anomalies = new ArrayList<>(combination.getAnomalies());
        for (ConsensusAnomaly anomaly : anomalies) {
            anomaly.setEntityId(series.getEntityId());
            impactCalculator.assess(anomaly, impactContext);
        }

        int suppressed = noiseSuppressionService.suppressAll(anomalies, detectorsRun);
        int active = anomalies.size() - suppressed;
        for (ConsensusAnomaly anomaly : anomalies) {
            metricsConfig.recordConsensus(anomaly.getState().name());
        }

        if (!anomalies.isEmpty()) {
            log.info("Evaluated {}/{}: {} consensus anomalies ({} active, {} suppressed) from {} candidates",
                    series.getEntityId(), series.getField(), anomalies.size(), active, suppressed,
                    combination.getTotalDetections());
        }

        return EvaluationReport.builder()
                .entityId(series.getEntityId())
                .field(series.getField())
                .success(true)
                .reason(anomalies.isEmpty()
                        ? "No anomalies found"
                        : String.format("%d consensus anomal%s (%d active, %d suppressed)",
                                anomalies.size(), anomalies.size() == 1 ? "y" : "ies", active, suppressed))
                .anomalies(anomalies)
                .runs(runs)
                .activeCount(active)
                .suppressedCount(suppressed)
                .consensusRate(combination.getConsensusRate())
                .evaluatedAt(clock.millis())
                .build();
    }
}
