package com.premiergroup.ad_spend_optimizer.optimizer;

import java.util.Arrays;

/**
 * Order statistics with linear interpolation between closest ranks.
 */
public final class Statistics {

    private Statistics() {
    }

    public static double median(double[] values) {
        return percentile(values, 50.0);
    }

    public static double percentile(double[] values, double percentile) {
        if (values.length == 0) {
            return 0.0;
        }
        double[] sorted = values.clone();
        Arrays.sort(sorted);
        double position = percentile / 100.0 * (sorted.length - 1);
        int lower = (int) Math.floor(position);
        int upper = (int) Math.ceil(position);
        if (lower == upper) {
            return sorted[lower];
        }
        return sorted[lower] + (sorted[upper] - sorted[lower]) * (position - lower);
    }

    /**
     * Median after capping every value at the given percentile.
     */
    public static double winsorizedMedian(double[] values, double capPercentile) {
        double cap = percentile(values, capPercentile);
        double[] capped = Arrays.stream(values).map(v -> Math.min(v, cap)).toArray();
        return median(capped);
    }

    public static double ratio(double numerator, double denominator) {
        return denominator > 0 ? numerator / denominator : 0.0;
    }

    public static double round2(double value) {
        return Math.round(value * 100.0) / 100.0;
    }
}
