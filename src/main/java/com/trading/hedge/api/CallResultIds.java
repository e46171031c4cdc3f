package com.trading.hedge.api;

/** Derives the deterministic call result id of a contract valuation. */
public final class CallResultIds {

    private CallResultIds() {
    }

    public static String make(String valuationId, String specificationId) {
        if (valuationId == null || specificationId == null) {
            throw new IllegalArgumentException("valuationId and specificationId are required");
        }
        return valuationId + "#" + specificationId;
    }

    public static String of(ContractValuation valuation) {
        return make(valuation.id(), valuation.specificationId());
    }
}
