package com.trading.hedge.error;

/**
 * The finite-difference delta of a path is not finite, typically because the
 * perturbation factor or a simulated price is zero.
 */
public class NumericFaultException extends HedgeAnalyticsException {
    private final String perturbationKey;
    private final int pathIndex;
    private final double dy;
    private final double dx;

    public NumericFaultException(String perturbationKey, int pathIndex, double dy, double dx) {
        super(String.format("Non-finite delta for '%s' on path %d: dy=%s dx=%s",
                perturbationKey, pathIndex, dy, dx));
        this.perturbationKey = perturbationKey;
        this.pathIndex = pathIndex;
        this.dy = dy;
        this.dx = dx;
    }

    public String getPerturbationKey() {
        return perturbationKey;
    }

    public int getPathIndex() {
        return pathIndex;
    }

    public double getDy() {
        return dy;
    }

    public double getDx() {
        return dx;
    }
}
