package com.reims.anomaly.service;

import com.reims.anomaly.config.DetectionConfig;
import com.reims.anomaly.exception.ConfigurationException;
import com.reims.anomaly.model.DetectorKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Reliability weight per detection method. Starts from the built-in weights,
 * overridden by {@code anomaly.detection.detector-weights}.
 */
@Component
public class DetectorWeightRegistry {

    private static final Logger log = LoggerFactory.getLogger(DetectorWeightRegistry.class);

    // Applied to method names that do not resolve to a DetectorKind
    public static final double UNKNOWN_METHOD_WEIGHT = 0.1;

    private final Map<DetectorKind, Double> weights = new ConcurrentHashMap<>();

    public DetectorWeightRegistry(DetectionConfig config) {
        for (DetectorKind kind : DetectorKind.values()) {
            weights.put(kind, kind.getDefaultWeight());
        }
        if (config.getDetectorWeights() != null) {
            config.getDetectorWeights().forEach(this::setMethodWeight);
        }
        log.info("Detector weights: {}", snapshot());
    }

    public double getWeight(DetectorKind kind) {
        return weights.getOrDefault(kind, kind.getDefaultWeight());
    }

    /**
     * Weight for a method named as in configuration or upstream payloads.
     * Unresolvable names get {@link #UNKNOWN_METHOD_WEIGHT} and a warning.
     */
    public double getMethodWeight(String method) {
        Optional<DetectorKind> kind = DetectorKind.resolve(method);
        if (kind.isEmpty()) {
            log.warn("Unknown detection method '{}', using fallback weight {}", method, UNKNOWN_METHOD_WEIGHT);
            return UNKNOWN_METHOD_WEIGHT;
        }
        return getWeight(kind.get());
    }

    public void setMethodWeight(String method, Double weight) {
        DetectorKind kind = DetectorKind.resolve(method)
                .orElseThrow(() -> new ConfigurationException("Unknown detection method: " + method));
        if (weight == null || Double.isNaN(weight) || weight < 0.0 || weight > 1.0) {
            throw new ConfigurationException("Weight for " + method + " must be in [0,1], got " + weight);
        }
        Double previous = weights.put(kind, weight);
        if (previous != null && previous.doubleValue() != weight) {
            log.info("Detector weight {} changed {} -> {}", kind.getCode(), previous, weight);
        }
    }

    public Map<DetectorKind, Double> snapshot() {
        return Collections.unmodifiableMap(new EnumMap<>(weights));
    }
}
