package com.trading.hedge.error;

import java.time.Duration;

/** The valuation did not complete within the caller's total budget. */
public class ValuationIncompleteException extends HedgeAnalyticsException {
    private final String callResultId;

    public ValuationIncompleteException(String callResultId, Duration budget) {
        super("Valuation did not complete: result " + callResultId + " not available after " + budget);
        this.callResultId = callResultId;
    }

    public ValuationIncompleteException(String callResultId, Throwable cause) {
        super("Valuation did not complete: interrupted while waiting for result " + callResultId, cause);
        this.callResultId = callResultId;
    }

    public String getCallResultId() {
        return callResultId;
    }
}
