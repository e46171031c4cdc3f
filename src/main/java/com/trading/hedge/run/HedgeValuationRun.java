package com.trading.hedge.run;

import java.util.List;
import java.util.Locale;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.trading.hedge.api.CallResultIds;
import com.trading.hedge.api.ContractSpecification;
import com.trading.hedge.api.ContractValuation;
import com.trading.hedge.api.MarketCalibration;
import com.trading.hedge.api.MarketSimulation;
import com.trading.hedge.api.ValuationEngine;
import com.trading.hedge.model.HedgeReport;
import com.trading.hedge.model.ValuationResult;
import com.trading.hedge.progress.ProgressListener;
import com.trading.hedge.progress.ProgressLogListener;
import com.trading.hedge.progress.ProgressTracker;
import com.trading.hedge.report.HedgeReportSink;
import com.trading.hedge.report.Periodisation;
import com.trading.hedge.sensitivity.SensitivityAggregator;
import com.trading.hedge.sensitivity.StorePriceLookup;
import com.trading.hedge.sync.CompletionSynchronizer;

/**
 * Drives one valuation end to end against a {@link ValuationEngine}:
 * <ol>
 * <li>compile the contract, register the calibration and simulate paths;</li>
 * <li>size a {@link ProgressTracker} from the call costs and attach it;</li>
 * <li>start the evaluation and block in the {@link CompletionSynchronizer};</li>
 * <li>aggregate hedge statistics and hand the report to the sinks.</li>
 * </ol>
 * Both notification subscriptions are released however the run ends.
 */
public class HedgeValuationRun {
    private static final Logger log = LogManager.getLogger(HedgeValuationRun.class);

    private final ValuationEngine engine;
    private final CompletionSynchronizer synchronizer;
    private final SensitivityAggregator aggregator;
    private final List<HedgeReportSink> sinks;
    private final List<ProgressListener> progressListeners;

    public HedgeValuationRun(ValuationEngine engine, List<HedgeReportSink> sinks) {
        this(engine, sinks, List.of());
    }

    public HedgeValuationRun(ValuationEngine engine, List<HedgeReportSink> sinks,
            List<ProgressListener> progressListeners) {
        this.engine = engine;
        this.synchronizer = new CompletionSynchronizer();
        this.aggregator = new SensitivityAggregator();
        this.sinks = List.copyOf(sinks);
        this.progressListeners = List.copyOf(progressListeners);
    }

    public HedgeReport run(RunSettings settings) {
        settings.validate();
        Periodisation periodisation = settings.resolvePeriodisation();

        long startCompile = System.nanoTime();
        ContractSpecification specification = engine.compile(settings.getSourceCode());
        log.info("Compilation in {}s", seconds(System.nanoTime() - startCompile));

        long startCalc = System.nanoTime();
        MarketCalibration calibration = engine.registerMarketCalibration(settings.priceProcessName(),
                settings.getPriceProcess());
        MarketSimulation simulation = engine.simulate(specification, calibration, settings.getPathCount(),
                settings.parsedObservationDate(), settings.getInterestRate(), settings.getPerturbationFactor());

        long totalCost = 0;
        for (int cost : engine.calcCallCosts(specification.id()).values()) {
            totalCost += cost;
        }

        try (ProgressTracker tracker = new ProgressTracker(totalCost, settings.toProgressSettings(),
                System::nanoTime)) {
            tracker.addListener(new ProgressLogListener(settings.getProgressLogIntervalMillis()));
            for (ProgressListener l : progressListeners) {
                tracker.addListener(l);
            }
            tracker.attach(engine.notifications());

            ContractValuation valuation = engine.evaluate(specification, simulation);
            String callResultId = CallResultIds.of(valuation);
            log.debug("Evaluation {} started, waiting for result {}", valuation.id(), callResultId);

            ValuationResult result = synchronizer.waitFor(callResultId, engine.resultStore(),
                    engine.notifications(), settings.pollTimeout(), settings.totalBudget());

            HedgeReport report = aggregator.aggregate(result,
                    new StorePriceLookup(engine.simulatedPriceStore(), simulation),
                    simulation.perturbationFactor(), settings.getPathCount());
            log.info("Results in {}s", seconds(System.nanoTime() - startCalc));

            for (HedgeReportSink sink : sinks) {
                sink.publish(settings.getTitle(), report, periodisation);
            }
            return report;
        }
    }

    static String seconds(long nanos) {
        return String.format(Locale.ROOT, "%.3f", nanos / 1e9);
    }
}
