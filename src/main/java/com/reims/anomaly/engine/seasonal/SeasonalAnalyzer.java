package com.reims.anomaly.engine.seasonal;

import com.reims.anomaly.engine.Scores;
import com.reims.anomaly.engine.statistical.SeriesStats;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.time.temporal.IsoFields;
import java.util.ArrayList;
import java.util.List;

/**
 * Splits a series into trend and seasonal parts and derives the value expected
 * for a target date. Degrades to a moving-average trend with no seasonality
 * when there are fewer than two full cycles of history; never throws on short input.
 */
@Component
public class SeasonalAnalyzer {

    private static final Logger log = LoggerFactory.getLogger(SeasonalAnalyzer.class);

    static final int DEFAULT_PERIOD = 12;
    static final int MIN_ADJUSTMENT_POINTS = 12;

    public SeasonalDecomposition decompose(double[] values, List<LocalDate> dates) {
        return decompose(values, dates, null);
    }

    /**
     * @param period cycle length in observations, or null to infer it from the dates
     */
    public SeasonalDecomposition decompose(double[] values, List<LocalDate> dates, Integer period) {
        int p = period != null && period > 0 ? period : detectPeriod(dates);

        if (p >= 2 && values.length >= 2 * p) {
            try {
                return StlDecomposer.decompose(values, p, true);
            } catch (RuntimeException e) {
                log.warn("STL decomposition failed for {} points, period {}: {}. Using moving average.",
                        values.length, p, e.getMessage());
            }
        }
        return movingAverageDecomposition(values);
    }

    /**
     * Seasonal period from the mean spacing of the dates: daily 7, weekly 52,
     * monthly 12, quarterly 4, anything sparser 1. Monthly when dates are unusable.
     */
    public int detectPeriod(List<LocalDate> dates) {
        if (dates == null || dates.size() < 2 || dates.contains(null)) {
            return DEFAULT_PERIOD;
        }
        long span = ChronoUnit.DAYS.between(dates.get(0), dates.get(dates.size() - 1));
        double days = Math.abs(span) / (double) (dates.size() - 1);

        if (days <= 1) return 7;
        if (days <= 7) return 52;
        if (days <= 31) return 12;
        if (days <= 93) return 4;
        return 1;
    }

    public SeasonalExpectation expectedValue(double[] values, List<LocalDate> dates, LocalDate targetDate) {
        return expectedValue(values, dates, targetDate, true);
    }

    /**
     * Latest trend level plus the average seasonal effect of the target's position
     * in the cycle.
     */
    public SeasonalExpectation expectedValue(double[] values, List<LocalDate> dates,
                                             LocalDate targetDate, boolean useSeasonality) {
        if (values.length < 3) {
            double mean = SeriesStats.mean(values);
            return SeasonalExpectation.builder()
                    .expectedValue(mean)
                    .trendValue(mean)
                    .seasonalComponent(0.0)
                    .confidence(Scores.sampleConfidence(values.length))
                    .method("mean")
                    .build();
        }

        SeasonalDecomposition decomposition = decompose(values, dates);
        double[] trend = decomposition.getTrend();
        double trendValue = trend.length > 0 ? trend[trend.length - 1] : SeriesStats.mean(values);

        double seasonalComponent = 0.0;
        if (useSeasonality && decomposition.hasSeasonality()) {
            int target = cyclePosition(targetDate, decomposition.getPeriod(), values.length);
            seasonalComponent = averageSeasonalAt(decomposition, dates, target);
        }

        return SeasonalExpectation.builder()
                .expectedValue(trendValue + seasonalComponent)
                .trendValue(trendValue)
                .seasonalComponent(seasonalComponent)
                .confidence(Scores.sampleConfidence(values.length))
                .method(decomposition.getMethod())
                .build();
    }

    /**
     * Multiplicative factor {@code 1 + avgSeasonal(month) / mean}. 1.0 with fewer
     * than 12 points, no seasonality, or a zero mean.
     */
    public double seasonalAdjustmentFactor(double[] values, List<LocalDate> dates, int targetMonth) {
        if (values.length < MIN_ADJUSTMENT_POINTS || dates == null || dates.size() != values.length) {
            return 1.0;
        }
        SeasonalDecomposition decomposition = decompose(values, dates);
        if (!decomposition.hasSeasonality()) {
            return 1.0;
        }

        double sum = 0.0;
        int count = 0;
        for (int i = 0; i < dates.size(); i++) {
            LocalDate date = dates.get(i);
            if (date != null && date.getMonthValue() == targetMonth) {
                sum += decomposition.getSeasonal()[i];
                count++;
            }
        }
        double mean = SeriesStats.mean(values);
        if (count == 0 || mean == 0.0) {
            return 1.0;
        }
        return 1.0 + (sum / count) / mean;
    }

    private double averageSeasonalAt(SeasonalDecomposition decomposition, List<LocalDate> dates, int target) {
        double[] seasonal = decomposition.getSeasonal();
        int period = decomposition.getPeriod();
        boolean dated = dates != null && dates.size() == seasonal.length && !dates.contains(null);

        double sum = 0.0;
        int count = 0;
        for (int i = 0; i < seasonal.length; i++) {
            int position = dated ? cyclePosition(dates.get(i), period, i) : i % period;
            if (position == target) {
                sum += seasonal[i];
                count++;
            }
        }
        return count == 0 ? 0.0 : sum / count;
    }

    /**
     * Position of a date within its cycle. Calendar-aligned for the known periods;
     * otherwise (or without a date) the observation index modulo the period.
     */
    static int cyclePosition(LocalDate date, int period, int fallbackIndex) {
        if (date == null) {
            return Math.floorMod(fallbackIndex, period);
        }
        switch (period) {
            case 12:
                return date.getMonthValue() - 1;
            case 4:
                return (date.getMonthValue() - 1) / 3;
            case 7:
                return date.getDayOfWeek().getValue() - 1;
            case 52:
                return Math.min(date.get(IsoFields.WEEK_OF_WEEK_BASED_YEAR), 52) - 1;
            default:
                return Math.floorMod(fallbackIndex, period);
        }
    }

    private SeasonalDecomposition movingAverageDecomposition(double[] values) {
        int n = values.length;
        double[] trend;
        if (n < 3) {
            trend = values.clone();
        } else {
            trend = centeredMovingAverage(values, Math.min(12, Math.max(3, n / 2)));
        }
        double[] residual = new double[n];
        for (int i = 0; i < n; i++) residual[i] = values[i] - trend[i];

        return SeasonalDecomposition.builder()
                .trend(trend)
                .seasonal(new double[n])
                .residual(residual)
                .period(1)
                .method(SeasonalDecomposition.METHOD_MOVING_AVERAGE)
                .build();
    }

    // Edges where the window does not fit are filled from the nearest full window.
    private static double[] centeredMovingAverage(double[] values, int window) {
        int n = values.length;
        double[] out = new double[n];
        List<Integer> filled = new ArrayList<>();
        for (int i = 0; i < n; i++) {
            int start = i - window / 2;
            int end = start + window;
            if (start < 0 || end > n) {
                out[i] = Double.NaN;
                continue;
            }
            out[i] = SeriesStats.mean(values, start, end);
            filled.add(i);
        }
        if (filled.isEmpty()) {
            double mean = SeriesStats.mean(values);
            for (int i = 0; i < n; i++) out[i] = mean;
            return out;
        }
        int first = filled.get(0);
        int last = filled.get(filled.size() - 1);
        for (int i = 0; i < first; i++) out[i] = out[first];
        for (int i = last + 1; i < n; i++) out[i] = out[last];
        return out;
    }
}
