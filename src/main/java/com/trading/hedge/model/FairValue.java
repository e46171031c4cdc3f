package com.trading.hedge.model;

import com.trading.hedge.util.PathStatistics;

/**
 * Base fair value of a valuation: either a single number or one sample per
 * simulated path. Statistics dispatch on the variant.
 */
public abstract class FairValue {

    private FairValue() {
    }

    public static FairValue scalar(double value) {
        return new Scalar(value);
    }

    public static FairValue samples(double[] pathValues) {
        return new Samples(pathValues);
    }

    public abstract double mean();

    /** Standard error of {@link #mean()} over {@code pathCount} paths. */
    public abstract double standardError(int pathCount);

    /** A deterministic fair value; its standard error is zero. */
    public static final class Scalar extends FairValue {
        private final double value;

        private Scalar(double value) {
            this.value = value;
        }

        @Override
        public double mean() {
            return value;
        }

        @Override
        public double standardError(int pathCount) {
            return 0.0;
        }

        @Override
        public String toString() {
            return "Scalar(" + value + ")";
        }
    }

    /** Per-path fair values. */
    public static final class Samples extends FairValue {
        private final double[] values;

        private Samples(double[] values) {
            if (values == null || values.length == 0) {
                throw new IllegalArgumentException("Fair value samples must not be empty");
            }
            this.values = values.clone();
        }

        @Override
        public double mean() {
            return PathStatistics.mean(values);
        }

        @Override
        public double standardError(int pathCount) {
            return PathStatistics.standardError(values, pathCount);
        }

        @Override
        public String toString() {
            return "Samples(n=" + values.length + ")";
        }
    }
}
