package com.trading.hedge.api;

import com.trading.hedge.model.SimulatedPrice;

/** Store of simulated prices keyed by {@link SimulatedPriceIds}. */
public interface SimulatedPriceStore {

    /** @return the simulated price, or null if none exists for the id. */
    SimulatedPrice get(String simulatedPriceId);
}
