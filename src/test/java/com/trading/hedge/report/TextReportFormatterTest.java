package com.trading.hedge.report;

import com.trading.hedge.model.HedgeReport;
import org.junit.Test;

import java.util.List;

import static org.junit.Assert.*;

public class TextReportFormatterTest {

    @Test
    public void testLayoutUsesThreeStandardErrors() {
        String text = new TextReportFormatter(Periodisation.MONTHLY).format(ReportFixtures.spotAndTwoMonths());

        assertTrue(text.contains("GAS (spot)\n"));
        assertTrue(text.contains("GAS-2011-1 (2011-01)\n"));
        assertTrue(text.contains("Price: 13.50\n"));
        assertTrue(text.contains("Hedge: -10.00 ± 1.50 units of GAS-2011-1\n"));
        assertTrue(text.contains("Cash in: 135.00 ± 12.00\n"));
        assertTrue(text.contains("Cum posn: 0.00 ± 0.60\n"));
        // Net figures come from the last period.
        assertTrue(text.contains("Net cash in: -5.00 ± 4.50\n"));
        assertTrue(text.contains("Net position: 0.00 ± 0.60\n"));
        assertTrue(text.endsWith("Fair value: 7.25 ± 0.15\n"));
    }

    @Test
    public void testDailyDates() {
        String text = new TextReportFormatter(Periodisation.DAILY).format(ReportFixtures.spotAndTwoMonths());
        assertTrue(text.contains("GAS-2011-2 (2011-02-01)\n"));
    }

    @Test
    public void testNoPeriodsPrintsOnlyFairValue() {
        String text = new TextReportFormatter(Periodisation.MONTHLY).format(new HedgeReport(3, 0, List.of()));
        assertEquals("Fair value: 3.00 ± 0.00\n", text);
    }
}
