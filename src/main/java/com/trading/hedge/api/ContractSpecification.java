package com.trading.hedge.api;

/** A compiled contract, as returned by {@link ValuationEngine#compile}. */
public record ContractSpecification(String id, String sourceCode) {
}
