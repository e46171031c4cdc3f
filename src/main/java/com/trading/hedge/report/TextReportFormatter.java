package com.trading.hedge.report;

import java.util.Locale;

import com.trading.hedge.model.HedgeReport;
import com.trading.hedge.model.SensitivityPeriod;

/**
 * Plain-text rendering of a {@link HedgeReport}. Uncertainties are shown as
 * three standard errors.
 *
 * <pre>
 * OIL-2020-1 (2020-01)
 * Price: 50.00
 * Hedge: -10.00 ± 0.12 units of OIL-2020-1
 * Cash in: 500.00 ± 3.10
 * Cum posn: -10.00 ± 0.12
 * </pre>
 */
public final class TextReportFormatter {
    private static final double CONFIDENCE_MULTIPLIER = 3.0;

    private final Periodisation periodisation;

    public TextReportFormatter(Periodisation periodisation) {
        this.periodisation = periodisation;
    }

    public String format(HedgeReport report) {
        StringBuilder sb = new StringBuilder(256);
        for (SensitivityPeriod p : report.getPeriods()) {
            sb.append(p.getCommodity()).append(" (").append(periodisation.format(p.getDate())).append(")\n");
            line(sb, "Price: %.2f", p.getPriceMean());
            line(sb, "Hedge: %.2f ± %.2f units of %s", p.getHedgeUnitsMean(),
                    CONFIDENCE_MULTIPLIER * p.getHedgeUnitsStderr(), p.getCommodity());
            line(sb, "Cash in: %.2f ± %.2f", p.getCashInMean(), CONFIDENCE_MULTIPLIER * p.getCashInStderr());
            line(sb, "Cum posn: %.2f ± %.2f", p.getCumulativePositionMean(),
                    CONFIDENCE_MULTIPLIER * p.getCumulativePositionStderr());
            sb.append('\n');
        }

        SensitivityPeriod last = report.lastPeriod();
        if (last != null) {
            line(sb, "Net cash in: %.2f ± %.2f", last.getCumulativeCashMean(),
                    CONFIDENCE_MULTIPLIER * last.getCumulativeCashStderr());
            line(sb, "Net position: %.2f ± %.2f", last.getCumulativePositionMean(),
                    CONFIDENCE_MULTIPLIER * last.getCumulativePositionStderr());
            sb.append('\n');
        }
        line(sb, "Fair value: %.2f ± %.2f", report.getFairValueMean(),
                CONFIDENCE_MULTIPLIER * report.getFairValueStderr());
        return sb.toString();
    }

    private static void line(StringBuilder sb, String format, Object... args) {
        sb.append(String.format(Locale.ROOT, format, args)).append('\n');
    }
}
