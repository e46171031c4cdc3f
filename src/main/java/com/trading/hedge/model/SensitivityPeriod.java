package com.trading.hedge.model;

import java.time.LocalDate;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/**
 * Hedge statistics of one perturbation bucket.
 *
 * Standard errors are sample standard deviations over the path dimension
 * divided by sqrt(pathCount), except {@link #getPriceStd()} which is the
 * unscaled dispersion of the simulated price itself.
 *
 * For the spot bucket {@link #getDate()} is null, the cumulative fields repeat
 * the bucket's own statistics and {@link #getTotalUnitsStderr()} is NaN.
 */
@Getter
@Builder
@ToString
public final class SensitivityPeriod {
    private final String commodity;
    private final LocalDate date;

    private final double hedgeUnitsMean;
    private final double hedgeUnitsStderr;

    private final double priceMean;
    private final double priceStd;

    private final double cashInMean;
    private final double cashInStderr;

    private final double cumulativePositionMean;
    private final double cumulativePositionStderr;

    private final double cumulativeCashMean;
    private final double cumulativeCashStderr;

    private final double totalUnitsStderr;

    public boolean isSpot() {
        return date == null;
    }
}
