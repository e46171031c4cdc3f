package com.trading.hedge.run;

import com.trading.hedge.error.MissingPriceException;
import com.trading.hedge.error.UnknownPeriodisationException;
import com.trading.hedge.error.ValuationIncompleteException;
import com.trading.hedge.model.HedgeReport;
import com.trading.hedge.model.ProgressSnapshot;
import com.trading.hedge.model.SensitivityPeriod;
import com.trading.hedge.report.HedgeReportSink;
import com.trading.hedge.report.LogReportSink;
import com.trading.hedge.report.Periodisation;
import org.junit.Test;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.junit.Assert.*;

public class HedgeValuationRunTest {
    private static final List<LocalDate> MONTHS = List.of(
            LocalDate.of(2011, 1, 1), LocalDate.of(2011, 2, 1), LocalDate.of(2011, 3, 1));

    @Test
    public void testEndToEndRun() {
        RunSettings settings = RunSettingsLoader.fromResource("gas-storage-run.json");
        List<ProgressSnapshot> progress = new CopyOnWriteArrayList<>();
        List<String> published = new ArrayList<>();

        try (FakeValuationEngine engine = new FakeValuationEngine("GAS", MONTHS, 1000)) {
            HedgeReportSink capture = (title, report, periodisation) -> {
                assertEquals(Periodisation.MONTHLY, periodisation);
                published.add(title);
            };
            HedgeValuationRun run = new HedgeValuationRun(engine, List.of(new LogReportSink(), capture),
                    List.of(progress::add));

            HedgeReport report = run.run(settings);

            assertEquals(List.of("Gas storage"), published);
            assertEquals(0, engine.bus().subscriberCount());

            // Spot first, then the three months in order.
            List<SensitivityPeriod> periods = report.getPeriods();
            assertEquals(4, periods.size());
            assertTrue(periods.get(0).isSpot());
            assertEquals("GAS", periods.get(0).getCommodity());
            assertEquals(MONTHS.get(0), periods.get(1).getDate());
            assertEquals(MONTHS.get(2), periods.get(3).getDate());

            for (SensitivityPeriod p : periods) {
                assertEquals(-1000.0, p.getHedgeUnitsMean(), 1e-6);
                assertEquals(0.0, p.getHedgeUnitsStderr(), 1e-6);
                assertEquals(1000.0 * p.getPriceMean(), p.getCashInMean(), 1e-6);
                assertTrue(p.getPriceStd() > 0);
            }
            assertEquals(-1000.0, periods.get(0).getCumulativePositionMean(), 1e-6);
            assertEquals(-3000.0, report.lastPeriod().getCumulativePositionMean(), 1e-6);

            // Fair value samples are 1000..1199.
            assertEquals(1099.5, report.getFairValueMean(), 1e-9);
            assertTrue(report.getFairValueStderr() > 0);

            long totalCost = FakeValuationEngine.COST_PER_NODE * (MONTHS.size() + 1);
            assertEquals(totalCost, progress.size());
            ProgressSnapshot last = progress.get(progress.size() - 1);
            assertEquals(totalCost, last.completed());
            assertEquals(100.0, last.percent(), 1e-9);
            assertEquals(0.0, last.eta(), 1e-9);
        }
    }

    @Test
    public void testTimingUsesDotDecimalSeparatorWhateverTheDefaultLocale() {
        Locale previous = Locale.getDefault();
        Locale.setDefault(Locale.GERMANY);
        try {
            assertEquals("1.500", HedgeValuationRun.seconds(1_500_000_000L));
        } finally {
            Locale.setDefault(previous);
        }
    }

    @Test
    public void testUnknownPeriodisationFailsBeforeCompiling() {
        RunSettings settings = RunSettingsLoader.fromResource("gas-storage-run.json");
        settings.setPeriodisation("quarterly");

        try (FakeValuationEngine engine = new FakeValuationEngine("GAS", MONTHS, 1000)) {
            try {
                new HedgeValuationRun(engine, List.of()).run(settings);
                fail("Expected UnknownPeriodisationException");
            } catch (UnknownPeriodisationException e) {
                assertTrue(e.getMessage().contains("quarterly"));
            }
            assertEquals(0, engine.compileCalls());
        }
    }

    @Test
    public void testMissingPriceReleasesSubscriptions() {
        RunSettings settings = RunSettingsLoader.fromResource("gas-storage-run.json");

        try (FakeValuationEngine engine = new FakeValuationEngine("GAS", MONTHS, 1000)
                .withholdPrice(MONTHS.get(1))) {
            try {
                new HedgeValuationRun(engine, List.of()).run(settings);
                fail("Expected MissingPriceException");
            } catch (MissingPriceException e) {
                assertEquals(MONTHS.get(1), e.getDate());
                assertEquals("GAS", e.getCommodity());
            }
            assertEquals(0, engine.bus().subscriberCount());
        }
    }

    @Test
    public void testBudgetExpiryIsFatal() {
        RunSettings settings = RunSettingsLoader.fromResource("gas-storage-run.json");
        settings.setTotalBudgetMillis(200);
        List<String> published = new ArrayList<>();

        try (FakeValuationEngine engine = new FakeValuationEngine("GAS", MONTHS, 1000).neverCompletes()) {
            try {
                new HedgeValuationRun(engine, List.of((t, r, p) -> published.add(t))).run(settings);
                fail("Expected ValuationIncompleteException");
            } catch (ValuationIncompleteException e) {
                assertEquals("valuation-1#spec-1", e.getCallResultId());
            }
            assertTrue(published.isEmpty());
            assertEquals(0, engine.bus().subscriberCount());
        }
    }
}
