package com.trading.hedge.api;

import java.time.LocalDate;

/**
 * A set of simulated market paths.
 *
 * @param id                 simulation id, the first component of every simulated price id.
 * @param observationDate    date at which spot prices are observed.
 * @param perturbationFactor relative shift used for the perturbed valuations.
 */
public record MarketSimulation(
        String id,
        String specificationId,
        LocalDate observationDate,
        int pathCount,
        double interestRate,
        double perturbationFactor) {
}
