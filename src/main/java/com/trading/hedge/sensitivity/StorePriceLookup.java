package com.trading.hedge.sensitivity;

import java.time.LocalDate;

import com.trading.hedge.api.MarketSimulation;
import com.trading.hedge.api.SimulatedPriceIds;
import com.trading.hedge.api.SimulatedPriceStore;
import com.trading.hedge.model.SimulatedPrice;

/** {@link SimulatedPriceLookup} backed by the engine's simulated price store. */
public final class StorePriceLookup implements SimulatedPriceLookup {
    private final SimulatedPriceStore store;
    private final MarketSimulation simulation;

    public StorePriceLookup(SimulatedPriceStore store, MarketSimulation simulation) {
        this.store = store;
        this.simulation = simulation;
    }

    @Override
    public SimulatedPrice find(String commodity, LocalDate date) {
        return store.get(SimulatedPriceIds.make(simulation.id(), commodity, date, date));
    }

    @Override
    public LocalDate observationDate() {
        return simulation.observationDate();
    }
}
