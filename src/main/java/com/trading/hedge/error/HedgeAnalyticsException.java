package com.trading.hedge.error;

/** Root of the failures raised while tracking or aggregating a valuation. */
public class HedgeAnalyticsException extends RuntimeException {

    public HedgeAnalyticsException(String message) {
        super(message);
    }

    public HedgeAnalyticsException(String message, Throwable cause) {
        super(message, cause);
    }
}
