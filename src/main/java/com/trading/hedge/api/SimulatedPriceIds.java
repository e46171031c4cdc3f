package com.trading.hedge.api;

import java.time.LocalDate;

/** Derives simulated price ids from (simulation, commodity, start, end). */
public final class SimulatedPriceIds {

    private SimulatedPriceIds() {
    }

    public static String make(String simulationId, String commodity, LocalDate start, LocalDate end) {
        return simulationId + "#" + commodity + "#" + start + "#" + end;
    }
}
