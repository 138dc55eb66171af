package com.jreinhal.oplogstats.util;

/**
 * Empirical quantiles over an ascending sample.
 */
public final class Quantiles {

    private Quantiles() {
    }

    /**
     * Quantile {@code p} of {@code sorted} by linear interpolation at rank {@code p * (n - 1)}.
     * {@code p = 0} is the first value and {@code p = 1} the last.
     *
     * @param p      in {@code [0, 1]}
     * @param sorted ascending, non-empty, without NaN
     */
    public static double empirical(double p, double[] sorted) {
        if (sorted == null || sorted.length == 0) {
            throw new IllegalArgumentException("quantile of an empty sample is undefined");
        }
        if (p < 0.0 || p > 1.0 || Double.isNaN(p)) {
            throw new IllegalArgumentException("quantile must be within [0, 1]: " + p);
        }
        int last = sorted.length - 1;
        double rank = p * last;
        int lower = (int) Math.floor(rank);
        if (lower >= last) {
            return sorted[last];
        }
        double fraction = rank - lower;
        if (fraction == 0.0) {
            return sorted[lower];
        }
        return sorted[lower] + fraction * (sorted[lower + 1] - sorted[lower]);
    }
}
