package com.reims.anomaly.engine;

/**
 * Shared clamping and confidence helpers used across detectors and the ensemble.
 */
public final class Scores {

    private Scores() {
    }

    public static double clamp01(double value) {
        if (Double.isNaN(value)) return 0.0;
        return Math.max(0.0, Math.min(1.0, value));
    }

    public static double clamp0100(double value) {
        if (Double.isNaN(value)) return 0.0;
        return Math.max(0.0, Math.min(100.0, value));
    }

    /**
     * Candidate confidence from the magnitude of a detector statistic:
     * 0.6 at the threshold region, rising to 0.95 once |magnitude| reaches {@code saturation}.
     */
    public static double confidenceFromMagnitude(double magnitude, double saturation) {
        if (saturation <= 0) return 0.6;
        double ratio = Math.min(Math.abs(magnitude) / saturation, 1.0);
        return clamp01(0.6 + 0.35 * ratio);
    }

    /**
     * Confidence that grows with history length: 0.3 below 3 points,
     * otherwise 0.5 + n/60 * 0.45 capped at 0.95.
     */
    public static double sampleConfidence(int sampleSize) {
        if (sampleSize < 3) return 0.3;
        return Math.min(0.95, 0.5 + (sampleSize / 60.0) * 0.45);
    }
}
