package com.trading.hedge.sensitivity;

import java.time.LocalDate;

import com.trading.hedge.model.SimulatedPrice;

/** Resolves simulated prices of the valuation's market simulation. */
public interface SimulatedPriceLookup {

    /** @return the simulated price, or null if the simulation has none for that date. */
    SimulatedPrice find(String commodity, LocalDate date);

    /** Date at which spot prices are observed. */
    LocalDate observationDate();
}
