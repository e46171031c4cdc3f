package com.trading.hedge.api;

/** Handle of an asynchronous evaluation started by {@link ValuationEngine#evaluate}. */
public record ContractValuation(String id, String specificationId, String simulationId) {
}
