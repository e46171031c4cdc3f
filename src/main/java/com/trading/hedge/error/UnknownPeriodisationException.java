package com.trading.hedge.error;

/** Configuration names a periodisation other than daily or monthly. */
public class UnknownPeriodisationException extends HedgeAnalyticsException {

    public UnknownPeriodisationException(String tag) {
        super("Unsupported periodisation: '" + tag + "' (expected 'daily' or 'monthly')");
    }
}
