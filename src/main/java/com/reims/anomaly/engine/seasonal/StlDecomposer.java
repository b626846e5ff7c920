package com.reims.anomaly.engine.seasonal;

import com.reims.anomaly.engine.statistical.SeriesStats;

import java.util.Arrays;

/**
 * Seasonal-trend decomposition by loess (Cleveland et al. 1990), additive model.
 * With {@code robust} set, outer iterations re-weight points by bisquare weights
 * on the remainder so isolated outliers do not bend the trend or seasonal curves.
 */
final class StlDecomposer {

    static final int SEASONAL_SPAN = 7;
    private static final int ROBUST_INNER = 2;
    private static final int ROBUST_OUTER = 15;
    private static final int PLAIN_INNER = 5;

    private StlDecomposer() {
    }

    static SeasonalDecomposition decompose(double[] y, int period, boolean robust) {
        int n = y.length;
        if (period < 2 || n < 2 * period) {
            throw new IllegalArgumentException("STL needs at least two full cycles: period " + period + ", points " + n);
        }

        int seasonalSpan = SEASONAL_SPAN;
        int lowPassSpan = nextOdd(period);
        int trendSpan = nextOdd((int) Math.ceil(1.5 * period / (1.0 - 1.5 / seasonalSpan)));
        int inner = robust ? ROBUST_INNER : PLAIN_INNER;
        int outer = robust ? ROBUST_OUTER : 0;

        double[] trend = new double[n];
        double[] seasonal = new double[n];
        double[] weights = null;

        for (int o = 0; o <= outer; o++) {
            for (int i = 0; i < inner; i++) {
                double[] detrended = new double[n];
                for (int t = 0; t < n; t++) detrended[t] = y[t] - trend[t];

                double[] cycle = smoothCycleSubseries(detrended, weights, period, seasonalSpan);
                double[] lowPass = lowPass(cycle, period, lowPassSpan, n);
                for (int t = 0; t < n; t++) {
                    seasonal[t] = cycle[period + t] - lowPass[t];
                }

                double[] deseasonalized = new double[n];
                for (int t = 0; t < n; t++) deseasonalized[t] = y[t] - seasonal[t];
                trend = Loess.smooth(deseasonalized, trendSpan, weights);
            }
            if (o < outer) {
                weights = robustnessWeights(y, trend, seasonal);
            }
        }

        double[] residual = new double[n];
        for (int t = 0; t < n; t++) residual[t] = y[t] - trend[t] - seasonal[t];

        return SeasonalDecomposition.builder()
                .trend(trend)
                .seasonal(seasonal)
                .residual(residual)
                .period(period)
                .method(SeasonalDecomposition.METHOD_STL)
                .build();
    }

    /**
     * Smooths each cycle-subseries and extends it by one cycle at both ends.
     * Output has length n + 2 * period, offset by one period.
     */
    private static double[] smoothCycleSubseries(double[] x, double[] weights, int period, int span) {
        int n = x.length;
        double[] out = new double[n + 2 * period];
        for (int k = 0; k < period; k++) {
            int m = (n - k + period - 1) / period;
            double[] sub = new double[m];
            double[] subWeights = weights == null ? null : new double[m];
            for (int j = 0; j < m; j++) {
                sub[j] = x[k + j * period];
                if (subWeights != null) subWeights[j] = weights[k + j * period];
            }
            for (int j = -1; j <= m; j++) {
                out[(j + 1) * period + k] = Loess.estimate(sub, span, subWeights, j);
            }
        }
        return out;
    }

    private static double[] lowPass(double[] cycle, int period, int span, int n) {
        double[] pass = movingAverage(cycle, period);
        pass = movingAverage(pass, period);
        pass = movingAverage(pass, 3);
        return Loess.smooth(Arrays.copyOf(pass, n), span, null);
    }

    private static double[] movingAverage(double[] x, int window) {
        int len = x.length - window + 1;
        double[] out = new double[Math.max(len, 0)];
        double sum = 0.0;
        for (int i = 0; i < window && i < x.length; i++) sum += x[i];
        for (int i = 0; i < len; i++) {
            out[i] = sum / window;
            if (i + window < x.length) {
                sum += x[i + window] - x[i];
            }
        }
        return out;
    }

    private static double[] robustnessWeights(double[] y, double[] trend, double[] seasonal) {
        int n = y.length;
        double[] absResidual = new double[n];
        for (int t = 0; t < n; t++) {
            absResidual[t] = Math.abs(y[t] - trend[t] - seasonal[t]);
        }
        double h = 6.0 * SeriesStats.median(absResidual);
        double[] weights = new double[n];
        for (int t = 0; t < n; t++) {
            if (h <= 1e-12) {
                weights[t] = 1.0;
                continue;
            }
            double u = absResidual[t] / h;
            weights[t] = u < 1.0 ? Math.pow(1.0 - u * u, 2) : 0.0;
        }
        return weights;
    }

    private static int nextOdd(int value) {
        int v = Math.max(value, 3);
        return v % 2 == 0 ? v + 1 : v;
    }
}
