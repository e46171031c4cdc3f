package com.trading.hedge.report;

import com.trading.hedge.model.HedgeReport;

/** Consumer of a finished report: console, file, chart or dashboard. */
@FunctionalInterface
public interface HedgeReportSink {

    void publish(String title, HedgeReport report, Periodisation periodisation);
}
