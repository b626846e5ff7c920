package com.reims.anomaly.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;
import java.util.Optional;

/**
 * Closed set of detection methods the ensemble knows how to weigh.
 * Default weights are curated reliability coefficients in [0, 1]; the default
 * confidence is what each method reports for its own runs, independent of
 * history length.
 */
public enum DetectorKind {
    Z_SCORE("z_score", Family.STATISTICAL, 0.12, 0.90),
    PERCENTAGE_CHANGE("percentage_change", Family.STATISTICAL, 0.08, 0.85),
    CUSUM("cusum", Family.STATISTICAL, 0.10, 0.85),
    VOLATILITY("volatility", Family.STATISTICAL, 0.10, 0.80),
    SEASONAL_DECOMPOSITION("seasonal_decomposition", Family.STATISTICAL, 0.13, 0.90),
    ISOLATION_FOREST("isolation_forest", Family.MODEL, 0.15, 0.85),
    LOCAL_OUTLIER_FACTOR("lof", Family.MODEL, 0.12, 0.85);

    public enum Family {
        STATISTICAL,
        MODEL
    }

    private final String code;
    private final Family family;
    private final double defaultWeight;
    private final double defaultConfidence;

    DetectorKind(String code, Family family, double defaultWeight, double defaultConfidence) {
        this.code = code;
        this.family = family;
        this.defaultWeight = defaultWeight;
        this.defaultConfidence = defaultConfidence;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    public Family getFamily() {
        return family;
    }

    public double getDefaultWeight() {
        return defaultWeight;
    }

    public double getDefaultConfidence() {
        return defaultConfidence;
    }

    /**
     * Resolves a method name as written in configuration: either the code
     * ({@code "z_score"}, {@code "lof"}) or the enum name, case-insensitive.
     */
    public static Optional<DetectorKind> resolve(String name) {
        if (name == null || name.isBlank()) {
            return Optional.empty();
        }
        String normalized = name.trim().toLowerCase(Locale.ROOT).replace('-', '_');
        for (DetectorKind kind : values()) {
            if (kind.code.equals(normalized) || kind.name().toLowerCase(Locale.ROOT).equals(normalized)) {
                return Optional.of(kind);
            }
        }
        return Optional.empty();
    }
}
