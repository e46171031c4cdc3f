package com.trading.hedge.model;

import java.time.LocalDate;

import lombok.Getter;

/** Simulated price of one commodity at one date, one sample per path. */
public final class SimulatedPrice {
    @Getter
    private final String commodity;
    @Getter
    private final LocalDate date;
    private final double[] values;

    public SimulatedPrice(String commodity, LocalDate date, double[] values) {
        if (values == null) {
            throw new IllegalArgumentException("Price samples are required for " + commodity + " on " + date);
        }
        this.commodity = commodity;
        this.date = date;
        this.values = values.clone();
    }

    /** @return a copy of the per-path prices. */
    public double[] getValues() {
        return values.clone();
    }

    public int pathCount() {
        return values.length;
    }
}
