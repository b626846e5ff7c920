package com.reims.anomaly.engine.statistical;

import java.util.Arrays;

/**
 * Descriptive statistics over primitive arrays. Standard deviations are sample (n - 1).
 */
public final class SeriesStats {

    private SeriesStats() {
    }

    public static double mean(double[] values) {
        return mean(values, 0, values.length);
    }

    public static double mean(double[] values, int from, int to) {
        if (to <= from) return 0.0;
        double sum = 0.0;
        for (int i = from; i < to; i++) {
            sum += values[i];
        }
        return sum / (to - from);
    }

    public static double sampleStdDev(double[] values) {
        return sampleStdDev(values, 0, values.length);
    }

    public static double sampleStdDev(double[] values, int from, int to) {
        int n = to - from;
        if (n < 2) return 0.0;
        double mean = mean(values, from, to);
        double sumSq = 0.0;
        for (int i = from; i < to; i++) {
            double d = values[i] - mean;
            sumSq += d * d;
        }
        return Math.sqrt(sumSq / (n - 1));
    }

    public static double median(double[] values) {
        if (values.length == 0) return 0.0;
        double[] sorted = values.clone();
        Arrays.sort(sorted);
        int mid = sorted.length / 2;
        return sorted.length % 2 == 0 ? (sorted[mid - 1] + sorted[mid]) / 2.0 : sorted[mid];
    }

    public static int countNonZero(double[] values) {
        int count = 0;
        for (double v : values) {
            if (v != 0.0) count++;
        }
        return count;
    }

    /** Copy of {@code values} without the element at {@code skip}. */
    public static double[] without(double[] values, int skip) {
        double[] out = new double[values.length - 1];
        System.arraycopy(values, 0, out, 0, skip);
        System.arraycopy(values, skip + 1, out, skip, values.length - skip - 1);
        return out;
    }
}
