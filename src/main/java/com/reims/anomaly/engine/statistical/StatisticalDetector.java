package com.reims.anomaly.engine.statistical;

import com.reims.anomaly.engine.Scores;
import com.reims.anomaly.exception.InsufficientDataException;
import com.reims.anomaly.model.AnomalyCandidate;
import com.reims.anomaly.model.AnomalyType;
import com.reims.anomaly.model.DetectorKind;
import com.reims.anomaly.model.Severity;
import com.reims.anomaly.model.StatisticType;
import com.reims.anomaly.model.TimeSeries;
import com.reims.anomaly.model.TimeSeriesPoint;

import java.util.ArrayList;
import java.util.List;

/**
 * The four classic statistical checks over a single series. Pure functions:
 * each returns the flagged points, or throws {@link InsufficientDataException}
 * when the series is too short for the check to mean anything.
 */
public final class StatisticalDetector {

    public static final int MIN_POINTS = 3;
    public static final int MIN_CUSUM_POINTS = 5;

    // |statistic| at which candidate confidence saturates at 0.95
    static final double ZSCORE_SATURATION = 4.0;
    static final double CUSUM_SATURATION = 6.0;
    static final double PCT_CHANGE_SATURATION = 200.0;
    static final double VOLATILITY_SATURATION = 4.0;

    private StatisticalDetector() {
    }

    /**
     * Scores each point against the mean and sample stdev of the other points,
     * so a single extreme value cannot mask itself by inflating the spread.
     * Points whose baseline has zero spread are never flagged.
     */
    public static List<AnomalyCandidate> detectZScore(TimeSeries series, double threshold) {
        double[] values = series.values();
        requireNonZeroPoints(values, MIN_POINTS);

        List<AnomalyCandidate> candidates = new ArrayList<>();
        for (int i = 0; i < values.length; i++) {
            double[] baseline = SeriesStats.without(values, i);
            double stdev = SeriesStats.sampleStdDev(baseline);
            if (stdev == 0.0) continue;

            double mean = SeriesStats.mean(baseline);
            double z = (values[i] - mean) / stdev;
            if (Math.abs(z) <= threshold) continue;

            candidates.add(candidate(series, i, DetectorKind.Z_SCORE, AnomalyType.POINT_OUTLIER)
                    .severity(Math.abs(z) > 4.0 ? Severity.HIGH : Severity.MEDIUM)
                    .expectedValue(mean)
                    .statistic(z)
                    .statisticType(StatisticType.Z_SCORE)
                    .confidence(Scores.confidenceFromMagnitude(z, ZSCORE_SATURATION))
                    .direction(z > 0 ? "above" : "below")
                    .reason(String.format("Value %.2f is %.2f standard deviations from baseline mean %.2f",
                            values[i], z, mean))
                    .build());
        }
        return candidates;
    }

    /**
     * Signed period-over-period change; pairs with a zero previous value are skipped.
     */
    public static List<AnomalyCandidate> detectPercentageChange(TimeSeries series, double threshold) {
        double[] values = series.values();
        requirePoints(values.length, MIN_POINTS);

        List<AnomalyCandidate> candidates = new ArrayList<>();
        for (int i = 1; i < values.length; i++) {
            double prev = values[i - 1];
            if (prev == 0.0) continue;

            double pct = (values[i] - prev) / prev * 100.0;
            if (Math.abs(pct) <= threshold) continue;

            candidates.add(candidate(series, i, DetectorKind.PERCENTAGE_CHANGE, AnomalyType.PERCENTAGE_CHANGE)
                    .severity(Math.abs(pct) > 100.0 ? Severity.HIGH : Severity.MEDIUM)
                    .expectedValue(prev)
                    .statistic(pct)
                    .statisticType(StatisticType.PCT_CHANGE)
                    .confidence(Scores.confidenceFromMagnitude(pct, PCT_CHANGE_SATURATION))
                    .direction(values[i] > prev ? "increase" : "decrease")
                    .reason(String.format("Changed %.1f%% from previous period (%.2f -> %.2f)",
                            pct, prev, values[i]))
                    .build());
        }
        return candidates;
    }

    /**
     * Two-sided CUSUM on the standardized series. Every point at which either
     * cumulative sum has reached {@code threshold} is flagged.
     */
    public static List<AnomalyCandidate> detectCusum(TimeSeries series, double threshold, double drift) {
        double[] values = series.values();
        requirePoints(values.length, MIN_CUSUM_POINTS);

        double mean = SeriesStats.mean(values);
        double stdev = SeriesStats.sampleStdDev(values);
        List<AnomalyCandidate> candidates = new ArrayList<>();
        if (stdev == 0.0) return candidates;

        double high = 0.0;
        double low = 0.0;
        for (int i = 1; i < values.length; i++) {
            double z = (values[i] - mean) / stdev;
            high = Math.max(0.0, high + z - drift);
            low = Math.min(0.0, low + z + drift);

            double magnitude = Math.max(Math.abs(high), Math.abs(low));
            if (magnitude < threshold) continue;

            boolean upward = high > Math.abs(low);
            candidates.add(candidate(series, i, DetectorKind.CUSUM, AnomalyType.LEVEL_SHIFT)
                    .severity(cusumSeverity(magnitude))
                    .expectedValue(mean)
                    .statistic(magnitude)
                    .statisticType(StatisticType.CUSUM_STAT)
                    .confidence(Scores.confidenceFromMagnitude(magnitude, CUSUM_SATURATION))
                    .direction(upward ? "upward_shift" : "downward_shift")
                    .reason(String.format("Cumulative deviation %.2f reached threshold %.2f (%s)",
                            magnitude, threshold, upward ? "upward shift" : "downward shift"))
                    .build());
        }
        return candidates;
    }

    /**
     * Rolling sample stdev over the last {@code lookback} points. A window is flagged
     * when its volatility exceeds twice the average window volatility; three times or
     * more is critical. The candidate points at the window's last observation.
     */
    public static List<AnomalyCandidate> detectVolatility(TimeSeries series, int window, int lookback) {
        TimeSeries recent = series.tail(lookback);
        int offset = series.size() - recent.size();
        double[] values = recent.values();
        requirePoints(values.length, Math.max(MIN_POINTS, window * 2));

        int windows = values.length - window + 1;
        double[] rolling = new double[windows];
        for (int i = 0; i < windows; i++) {
            rolling[i] = SeriesStats.sampleStdDev(values, i, i + window);
        }
        double average = SeriesStats.mean(rolling);

        List<AnomalyCandidate> candidates = new ArrayList<>();
        if (average == 0.0) return candidates;

        for (int i = 0; i < windows; i++) {
            double ratio = rolling[i] / average;
            if (ratio <= 2.0) continue;

            int pointIndex = offset + i + window - 1;
            double windowMean = SeriesStats.mean(values, i, i + window);
            candidates.add(candidate(series, pointIndex, DetectorKind.VOLATILITY, AnomalyType.VOLATILITY_SPIKE)
                    .severity(ratio < 3.0 ? Severity.HIGH : Severity.CRITICAL)
                    .expectedValue(windowMean)
                    .statistic(ratio)
                    .statisticType(StatisticType.VOLATILITY_RATIO)
                    .confidence(Scores.confidenceFromMagnitude(ratio, VOLATILITY_SATURATION))
                    .direction("volatility_increase")
                    .reason(String.format("Rolling volatility %.2f is %.1fx the average %.2f",
                            rolling[i], ratio, average))
                    .build());
        }
        return candidates;
    }

    static Severity cusumSeverity(double magnitude) {
        if (magnitude >= 6.0) return Severity.CRITICAL;
        if (magnitude >= 5.0) return Severity.HIGH;
        return Severity.MEDIUM;
    }

    private static AnomalyCandidate.AnomalyCandidateBuilder candidate(TimeSeries series, int index,
                                                                      DetectorKind method, AnomalyType type) {
        TimeSeriesPoint point = series.get(index);
        return AnomalyCandidate.builder()
                .field(series.getField())
                .anomalyType(type)
                .method(method)
                .periodKey(point.getPeriodKey())
                .index(index)
                .value(point.getValue());
    }

    private static void requirePoints(int actual, int required) {
        if (actual < required) {
            throw new InsufficientDataException(required, actual);
        }
    }

    private static void requireNonZeroPoints(double[] values, int required) {
        requirePoints(values.length, required);
        int nonZero = SeriesStats.countNonZero(values);
        if (nonZero < required) {
            throw new InsufficientDataException(required, nonZero);
        }
    }
}
