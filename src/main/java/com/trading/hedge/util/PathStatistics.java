package com.trading.hedge.util;

/**
 * Sample statistics over the path dimension.
 *
 * Standard deviations are population deviations (divide by N) computed in two
 * passes, subtracting the mean before squaring to avoid cancellation when
 * values are large relative to their spread.
 */
public final class PathStatistics {

    private PathStatistics() {
    }

    public static double mean(double[] values) {
        if (values.length == 0) {
            throw new IllegalArgumentException("Cannot take the mean of an empty vector");
        }
        double sum = 0.0;
        for (double v : values) {
            sum += v;
        }
        return sum / values.length;
    }

    public static double std(double[] values) {
        double mean = mean(values);
        double sumSq = 0.0;
        for (double v : values) {
            double dev = v - mean;
            sumSq += dev * dev;
        }
        return Math.sqrt(sumSq / values.length);
    }

    /** {@code std(values) / sqrt(pathCount)}. */
    public static double standardError(double[] values, int pathCount) {
        if (pathCount <= 0) {
            throw new IllegalArgumentException("pathCount must be positive: " + pathCount);
        }
        return std(values) / Math.sqrt(pathCount);
    }

    /** {@code target[i] += increment[i]} for every path. */
    public static void addInPlace(double[] target, double[] increment) {
        if (target.length != increment.length) {
            throw new IllegalArgumentException(
                    "Vector length mismatch: " + target.length + " vs " + increment.length);
        }
        for (int i = 0; i < target.length; i++) {
            target[i] += increment[i];
        }
    }
}
