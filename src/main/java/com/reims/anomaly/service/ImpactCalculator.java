package com.reims.anomaly.service;

import com.reims.anomaly.config.DetectionConfig;
import com.reims.anomaly.config.MetricsConfig;
import com.reims.anomaly.engine.Scores;
import com.reims.anomaly.model.AnomalyCandidate;
import com.reims.anomaly.model.ConsensusAnomaly;
import com.reims.anomaly.model.DscrProximity;
import com.reims.anomaly.model.ImpactAssessment;
import com.reims.anomaly.model.ImpactContext;
import org.springframework.stereotype.Service;

/**
 * Scores how much a finding matters in dollars and covenant terms (0-100):
 *
 *   variance  min(40, |actual - expected| / 250)
 *   category  min(30, variance as % of parent total * 3)
 *   DSCR      30 / 20 / 10 / 0 by distance to covenant (&lt;0.1, &lt;0.25, &lt;0.5),
 *             plus min(10, |dscrImpact| * 50) when |dscrImpact| &gt; 0.1
 */
@Service
public class ImpactCalculator {

    static final double BREACH_RISK_DISTANCE = 0.1;

    private final DetectionConfig config;
    private final MetricsConfig metricsConfig;

    public ImpactCalculator(DetectionConfig config, MetricsConfig metricsConfig) {
        this.config = config;
        this.metricsConfig = metricsConfig;
    }

    public ImpactAssessment calculate(double actual, double expected, ImpactContext context) {
        ImpactContext ctx = context != null ? context : new ImpactContext();
        double absoluteVariance = Math.abs(actual - expected);

        Double parentTotal = ctx.getParentTotal();
        double parentPct = parentTotal != null && parentTotal > 0
                ? absoluteVariance / parentTotal * 100.0
                : 0.0;

        DscrProximity dscr = dscrProximity(absoluteVariance, ctx);

        double varianceComponent = Math.min(40.0, absoluteVariance / 250.0);
        double categoryComponent = Math.min(30.0, parentPct * 3.0);
        double dscrComponent = dscrBand(dscr.getDistanceToThreshold());
        if (Math.abs(dscr.getDscrImpact()) > 0.1) {
            dscrComponent += Math.min(10.0, Math.abs(dscr.getDscrImpact()) * 50.0);
        }

        return ImpactAssessment.builder()
                .absoluteVariance(absoluteVariance)
                .parentCategoryImpactPct(parentPct)
                .parentTotal(parentTotal != null ? parentTotal : 0.0)
                .dscr(dscr)
                .varianceComponent(varianceComponent)
                .categoryComponent(categoryComponent)
                .dscrComponent(dscrComponent)
                .impactScore(Scores.clamp0100(varianceComponent + categoryComponent + dscrComponent))
                .build();
    }

    /** Attaches an assessment built from the anomaly's representative candidate. */
    public ImpactAssessment assess(ConsensusAnomaly anomaly, ImpactContext context) {
        AnomalyCandidate representative = anomaly.getRepresentative();
        ImpactAssessment impact = calculate(representative.getValue(), representative.getExpectedValue(), context);
        anomaly.setImpact(impact);
        metricsConfig.recordImpactScore(impact.getImpactScore());
        return impact;
    }

    DscrProximity dscrProximity(double absoluteVariance, ImpactContext ctx) {
        double threshold = ctx.getCovenantThreshold() != null
                ? ctx.getCovenantThreshold()
                : config.getDscrCovenantThreshold();

        Double current = ctx.getCurrentDscr();
        Double debtService = ctx.getAnnualDebtService();
        if (current == null && ctx.getNetOperatingIncome() != null && debtService != null && debtService > 0) {
            current = ctx.getNetOperatingIncome() / debtService;
        }

        Double distance = current != null ? current - threshold : null;
        double dscrImpact = debtService != null && debtService > 0 ? absoluteVariance / debtService : 0.0;

        return DscrProximity.builder()
                .currentDscr(current)
                .threshold(threshold)
                .distanceToThreshold(distance)
                .breachRisk(distance != null && distance < BREACH_RISK_DISTANCE)
                .dscrImpact(dscrImpact)
                .build();
    }

    static double dscrBand(Double distance) {
        if (distance == null || Double.isNaN(distance)) return 0.0;
        if (distance < 0.1) return 30.0;
        if (distance < 0.25) return 20.0;
        if (distance < 0.5) return 10.0;
        return 0.0;
    }
}
