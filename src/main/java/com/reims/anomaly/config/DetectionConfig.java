package com.reims.anomaly.config;

import com.reims.anomaly.exception.ConfigurationException;
import com.reims.anomaly.model.DetectorKind;
import jakarta.annotation.PostConstruct;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.LinkedHashMap;
import java.util.Map;

@Data
@Configuration
@ConfigurationProperties(prefix = "anomaly.detection")
public class DetectionConfig {

    // |z| above which a point is an outlier
    private double zscoreThreshold = 3.0;

    // Signed period-over-period change (%) above which a pair is flagged
    private double percentageChangeThreshold = 50.0;

    // CUSUM decision interval and slack, both in standard deviations
    private double cusumThreshold = 3.0;
    private double cusumDrift = 0.5;

    // Rolling stdev window and how many trailing points the volatility check looks at
    private int volatilityWindow = 3;
    private int volatilityLookback = 12;

    // Ensemble: distinct methods required, and the weighted confidence (0-1) required
    private int minAgreementCount = 2;
    private double ensembleConfidenceThreshold = 0.6;

    // Noise suppression floors
    private double minAgreementThreshold = 0.3;
    private double confidenceSuppressionFloor = 0.5;
    private double materialityFloor = 100.0;

    private double dscrCovenantThreshold = 1.25;

    // How many trailing points the seasonal deviation detector checks
    private int seasonalRecentPoints = 3;

    // method code -> weight in [0,1]; unset methods keep their built-in weight
    private Map<String, Double> detectorWeights = new LinkedHashMap<>();

    // method code -> confidence in [0,1] each run reports; unset methods keep their built-in value
    private Map<String, Double> methodConfidence = new LinkedHashMap<>();

    /**
     * Confidence a method attaches to its runs. Fixed per method, so a short
     * history does not by itself keep a clear anomaly from reaching consensus.
     */
    public double methodConfidenceFor(DetectorKind kind) {
        if (methodConfidence != null) {
            for (Map.Entry<String, Double> entry : methodConfidence.entrySet()) {
                if (DetectorKind.resolve(entry.getKey()).orElse(null) == kind && entry.getValue() != null) {
                    return entry.getValue();
                }
            }
        }
        return kind.getDefaultConfidence();
    }

    /**
     * Rejects values that would make detection meaningless. Runs once when the
     * configuration is bound, so a bad deployment fails at startup.
     */
    @PostConstruct
    public void validate() {
        requireNonNegative("zscore-threshold", zscoreThreshold);
        requireNonNegative("percentage-change-threshold", percentageChangeThreshold);
        requireNonNegative("cusum-threshold", cusumThreshold);
        requireNonNegative("cusum-drift", cusumDrift);
        requireNonNegative("materiality-floor", materialityFloor);
        requireNonNegative("dscr-covenant-threshold", dscrCovenantThreshold);
        requireUnit("ensemble-confidence-threshold", ensembleConfidenceThreshold);
        requireUnit("min-agreement-threshold", minAgreementThreshold);
        requireUnit("confidence-suppression-floor", confidenceSuppressionFloor);

        if (volatilityWindow < 2) {
            throw new ConfigurationException("volatility-window must be at least 2, got " + volatilityWindow);
        }
        if (volatilityLookback < volatilityWindow) {
            throw new ConfigurationException("volatility-lookback (" + volatilityLookback
                    + ") must not be smaller than volatility-window (" + volatilityWindow + ")");
        }
        if (minAgreementCount < 1) {
            throw new ConfigurationException("min-agreement-count must be at least 1, got " + minAgreementCount);
        }
        if (seasonalRecentPoints < 1) {
            throw new ConfigurationException("seasonal-recent-points must be at least 1, got " + seasonalRecentPoints);
        }

        requireMethodMap("detector-weights", "Weight", detectorWeights);
        requireMethodMap("method-confidence", "Confidence", methodConfidence);
    }

    private static void requireMethodMap(String key, String label, Map<String, Double> values) {
        if (values == null) return;
        for (Map.Entry<String, Double> entry : values.entrySet()) {
            if (DetectorKind.resolve(entry.getKey()).isEmpty()) {
                throw new ConfigurationException("Unknown detection method in " + key + ": " + entry.getKey());
            }
            Double value = entry.getValue();
            if (value == null || value < 0.0 || value > 1.0) {
                throw new ConfigurationException(label + " for " + entry.getKey() + " must be in [0,1], got " + value);
            }
        }
    }

    private static void requireNonNegative(String key, double value) {
        if (value < 0 || Double.isNaN(value)) {
            throw new ConfigurationException(key + " must not be negative, got " + value);
        }
    }

    private static void requireUnit(String key, double value) {
        if (value < 0 || value > 1 || Double.isNaN(value)) {
            throw new ConfigurationException(key + " must be in [0,1], got " + value);
        }
    }
}
