package com.trading.hedge.model;

/**
 * Point-in-time progress of a running valuation.
 *
 * @param completed number of unit-of-work notifications seen so far.
 * @param totalCost expected number of units.
 * @param percent   {@code 100 * completed / totalCost}, or 100 when totalCost is zero.
 * @param rate      recent throughput in units per second; NaN when totalCost is zero.
 * @param eta       estimated seconds to completion; best effort, NaN when totalCost is zero.
 */
public record ProgressSnapshot(long completed, long totalCost, double percent, double rate, double eta) {

    public boolean isDegenerate() {
        return totalCost == 0;
    }
}
