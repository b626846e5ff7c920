package com.reims.anomaly.engine.seasonal;

/**
 * Locally linear regression with tricube neighbourhood weights, evaluated on an
 * integer grid (x = 0..n-1). Positions outside the grid are extrapolated from
 * the nearest {@code span} points.
 */
final class Loess {

    private Loess() {
    }

    /** Smooths {@code y} at every grid position. */
    static double[] smooth(double[] y, int span, double[] robustness) {
        double[] out = new double[y.length];
        for (int i = 0; i < y.length; i++) {
            out[i] = estimate(y, span, robustness, i);
        }
        return out;
    }

    /**
     * Local linear estimate at {@code at}.
     *
     * @param robustness per-point weights multiplied into the tricube weights, or null
     */
    static double estimate(double[] y, int span, double[] robustness, double at) {
        int n = y.length;
        if (n == 0) return 0.0;
        if (n == 1) return y[0];

        int q = Math.min(span, n);
        int left;
        if (at <= 0) {
            left = 0;
        } else if (at >= n - 1) {
            left = n - q;
        } else {
            left = (int) Math.round(at) - q / 2;
            left = Math.max(0, Math.min(n - q, left));
        }
        int right = left + q - 1;

        double h = Math.max(at - left, right - at);
        if (span > n) {
            h += (span - n) / 2.0;
        }
        if (h <= 0) h = 1.0;

        double value = fit(y, robustness, left, right, at, h);
        if (Double.isNaN(value) && robustness != null) {
            // every neighbour was down-weighted to zero
            value = fit(y, null, left, right, at, h);
        }
        if (Double.isNaN(value)) {
            double sum = 0.0;
            for (int i = left; i <= right; i++) sum += y[i];
            value = sum / q;
        }
        return value;
    }

    private static double fit(double[] y, double[] robustness, int left, int right, double at, double h) {
        double sumW = 0.0;
        double sumWx = 0.0;
        double sumWy = 0.0;
        double[] w = new double[right - left + 1];
        for (int i = left; i <= right; i++) {
            double u = Math.abs(i - at) / h;
            double weight = u < 1.0 ? Math.pow(1.0 - u * u * u, 3) : 0.0;
            if (robustness != null) weight *= robustness[i];
            w[i - left] = weight;
            sumW += weight;
            sumWx += weight * i;
            sumWy += weight * y[i];
        }
        if (sumW <= 0.0) return Double.NaN;

        double xBar = sumWx / sumW;
        double yBar = sumWy / sumW;
        double sxx = 0.0;
        double sxy = 0.0;
        for (int i = left; i <= right; i++) {
            double dx = i - xBar;
            sxx += w[i - left] * dx * dx;
            sxy += w[i - left] * dx * y[i];
        }
        if (sxx < 1e-12) return yBar;
        return yBar + (sxy / sxx) * (at - xBar);
    }
}
