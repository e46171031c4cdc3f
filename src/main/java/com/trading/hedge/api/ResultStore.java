package com.trading.hedge.api;

import com.trading.hedge.model.ValuationResult;

/**
 * Authoritative store of call results, owned by the valuation engine.
 * Implementations must be safe for reads from any thread.
 */
public interface ResultStore {

    boolean contains(String callResultId);

    /** @return the result, or null if it has not been stored. */
    ValuationResult get(String callResultId);
}
