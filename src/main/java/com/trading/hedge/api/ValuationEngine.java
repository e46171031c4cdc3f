package com.trading.hedge.api;

import java.time.LocalDate;
import java.util.Map;

/**
 * The external Monte-Carlo valuation engine.
 *
 * The engine compiles contracts, simulates market paths and evaluates the
 * contract asynchronously, computing a base fair value and one perturbed fair
 * value per (commodity, delivery period) in each direction. Progress and
 * completion are reported on {@link #notifications()}; the engine writes the
 * call result to {@link #resultStore()} before it announces
 * {@link NotificationType#RESULT_CREATED}.
 */
public interface ValuationEngine {

    ContractSpecification compile(String sourceCode);

    MarketCalibration registerMarketCalibration(String priceProcessName, Map<String, Object> calibrationParams);

    MarketSimulation simulate(ContractSpecification specification, MarketCalibration calibration, int pathCount,
            LocalDate observationDate, double interestRate, double perturbationFactor);

    /**
     * Estimated cost of every node in the contract's dependency graph. The sum
     * of the values is the number of unit-of-work notifications the evaluation
     * is expected to emit.
     */
    Map<String, Integer> calcCallCosts(String specificationId);

    /** Starts the evaluation and returns immediately. */
    ContractValuation evaluate(ContractSpecification specification, MarketSimulation simulation);

    NotificationStream notifications();

    ResultStore resultStore();

    SimulatedPriceStore simulatedPriceStore();
}
