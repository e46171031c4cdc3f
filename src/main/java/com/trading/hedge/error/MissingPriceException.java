package com.trading.hedge.error;

import java.time.LocalDate;

/**
 * A simulated price required by the aggregation is not in the price store.
 * Aggregation aborts; prices are never substituted or interpolated.
 */
public class MissingPriceException extends HedgeAnalyticsException {
    private final String commodity;
    private final LocalDate date;

    public MissingPriceException(String commodity, LocalDate date) {
        super("Simulated price for " + commodity + " on " + date + " is unavailable");
        this.commodity = commodity;
        this.date = date;
    }

    public String getCommodity() {
        return commodity;
    }

    public LocalDate getDate() {
        return date;
    }
}
