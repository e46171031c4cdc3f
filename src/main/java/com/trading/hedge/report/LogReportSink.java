package com.trading.hedge.report;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.trading.hedge.model.HedgeReport;

/** Writes the text rendering of a report to the log. */
public final class LogReportSink implements HedgeReportSink {
    private static final Logger log = LogManager.getLogger(LogReportSink.class);

    @Override
    public void publish(String title, HedgeReport report, Periodisation periodisation) {
        log.info("{}\n{}", title, new TextReportFormatter(periodisation).format(report));
    }
}
