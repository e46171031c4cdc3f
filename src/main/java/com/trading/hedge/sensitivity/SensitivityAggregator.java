package com.trading.hedge.sensitivity;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

import com.trading.hedge.error.MissingPriceException;
import com.trading.hedge.error.NumericFaultException;
import com.trading.hedge.model.FairValue;
import com.trading.hedge.model.HedgeReport;
import com.trading.hedge.model.PerturbationKey;
import com.trading.hedge.model.SensitivityPeriod;
import com.trading.hedge.model.SimulatedPrice;
import com.trading.hedge.model.ValuationResult;
import com.trading.hedge.util.PathStatistics;

import lombok.extern.log4j.Log4j2;

/**
 * Converts the perturbed valuations of a completed result into hedge ratios
 * and cash-flow statistics per delivery period.
 *
 * <p>
 * For each perturbation key with price vector {@code S} and perturbation
 * factor {@code e}, per path:
 *
 * <pre>
 * dy     = V(+e) - V(-e)
 * dx     = 2 * e * S
 * delta  = dy / dx
 * hedge  = -delta
 * cashIn = -hedge * S
 * </pre>
 *
 * Spot keys (bare commodity names) use the price at the simulation's
 * observation date and stand alone. Dated keys are processed in (year, month,
 * day) order and accumulate {@code hedge} and {@code cashIn} path by path, so
 * the cumulative standard errors keep the correlation between periods.
 *
 * <p>
 * The aggregator is stateless and single-threaded. Its only side effects are
 * the price lookups. It must only be called once the result is in the store.
 */
@Log4j2
public final class SensitivityAggregator {

    private static final Comparator<PerturbationKey> SPOT_ORDER = Comparator.comparing(PerturbationKey::commodity);

    /**
     * @throws MissingPriceException  if a required simulated price is absent.
     * @throws NumericFaultException  if a delta is not finite.
     * @throws IllegalStateException  if a key lacks its negated counterpart or a
     *                                vector has the wrong number of paths.
     */
    public HedgeReport aggregate(ValuationResult result, SimulatedPriceLookup prices, double perturbationFactor,
            int pathCount) {
        if (pathCount <= 0) {
            throw new IllegalArgumentException("pathCount must be positive: " + pathCount);
        }

        FairValue fairValue = result.getFairValue();
        double fairValueMean = fairValue.mean();
        double fairValueStderr = fairValue.standardError(pathCount);

        List<PerturbationKey> spotKeys = new ArrayList<>();
        List<PerturbationKey> datedKeys = new ArrayList<>();
        for (String raw : result.perturbedKeys()) {
            if (PerturbationKey.isNegated(raw)) {
                continue;
            }
            if (PerturbationKey.isPartiallyDated(raw)) {
                log.warn("Skipping perturbation key '{}' (expected NAME or NAME-YEAR-MONTH[-DAY])", raw);
                continue;
            }
            PerturbationKey key = PerturbationKey.parse(raw);
            (key.isSpot() ? spotKeys : datedKeys).add(key);
        }
        spotKeys.sort(SPOT_ORDER);
        datedKeys.sort(PerturbationKey.CHRONOLOGICAL);

        List<SensitivityPeriod> periods = new ArrayList<>(spotKeys.size() + datedKeys.size());

        for (PerturbationKey key : spotKeys) {
            double[] price = requirePrice(prices, key.commodity(), prices.observationDate(), pathCount);
            double[] hedge = hedgeUnits(key, result, price, perturbationFactor, pathCount);
            double[] cash = cashIn(hedge, price);

            double hedgeMean = PathStatistics.mean(hedge);
            double hedgeStderr = PathStatistics.standardError(hedge, pathCount);
            double cashMean = PathStatistics.mean(cash);
            double cashStderr = PathStatistics.standardError(cash, pathCount);
            periods.add(SensitivityPeriod.builder()
                    .commodity(key.text())
                    .date(null)
                    .hedgeUnitsMean(hedgeMean)
                    .hedgeUnitsStderr(hedgeStderr)
                    .priceMean(PathStatistics.mean(price))
                    .priceStd(PathStatistics.std(price))
                    .cashInMean(cashMean)
                    .cashInStderr(cashStderr)
                    .cumulativePositionMean(hedgeMean)
                    .cumulativePositionStderr(hedgeStderr)
                    .cumulativeCashMean(cashMean)
                    .cumulativeCashStderr(cashStderr)
                    .totalUnitsStderr(Double.NaN)
                    .build());
        }

        double[] totalUnits = new double[pathCount];
        double[] totalCash = new double[pathCount];
        for (PerturbationKey key : datedKeys) {
            double[] price = requirePrice(prices, key.commodity(), key.date(), pathCount);
            double[] hedge = hedgeUnits(key, result, price, perturbationFactor, pathCount);
            double[] cash = cashIn(hedge, price);

            PathStatistics.addInPlace(totalUnits, hedge);
            PathStatistics.addInPlace(totalCash, cash);

            double totalUnitsStderr = PathStatistics.standardError(totalUnits, pathCount);
            periods.add(SensitivityPeriod.builder()
                    .commodity(key.text())
                    .date(key.date())
                    .hedgeUnitsMean(PathStatistics.mean(hedge))
                    .hedgeUnitsStderr(PathStatistics.standardError(hedge, pathCount))
                    .priceMean(PathStatistics.mean(price))
                    .priceStd(PathStatistics.std(price))
                    .cashInMean(PathStatistics.mean(cash))
                    .cashInStderr(PathStatistics.standardError(cash, pathCount))
                    .cumulativePositionMean(PathStatistics.mean(totalUnits))
                    .cumulativePositionStderr(totalUnitsStderr)
                    .cumulativeCashMean(PathStatistics.mean(totalCash))
                    .cumulativeCashStderr(PathStatistics.standardError(totalCash, pathCount))
                    .totalUnitsStderr(totalUnitsStderr)
                    .build());
        }

        log.debug("Aggregated result {}: {} spot and {} dated periods over {} paths",
                result.getId(), spotKeys.size(), datedKeys.size(), pathCount);
        return new HedgeReport(fairValueMean, fairValueStderr, periods);
    }

    private static double[] requirePrice(SimulatedPriceLookup prices, String commodity, LocalDate date,
            int pathCount) {
        SimulatedPrice price = prices.find(commodity, date);
        if (price == null) {
            throw new MissingPriceException(commodity, date);
        }
        if (price.pathCount() != pathCount) {
            throw new IllegalStateException("Simulated price of " + commodity + " on " + date + " has "
                    + price.pathCount() + " paths, expected " + pathCount);
        }
        return price.getValues();
    }

    /** Pathwise {@code -(V+ - V-) / (2 e S)}; fails on the first non-finite delta. */
    static double[] hedgeUnits(PerturbationKey key, ValuationResult result, double[] price,
            double perturbationFactor, int pathCount) {
        double[] up = result.requirePerturbedValue(key.text(), pathCount);
        double[] down = result.requirePerturbedValue(key.negatedText(), pathCount);

        double[] hedge = new double[pathCount];
        for (int i = 0; i < pathCount; i++) {
            double dy = up[i] - down[i];
            double dx = 2 * perturbationFactor * price[i];
            double contractDelta = dy / dx;
            if (!Double.isFinite(contractDelta)) {
                throw new NumericFaultException(key.text(), i, dy, dx);
            }
            hedge[i] = -contractDelta;
        }
        return hedge;
    }

    static double[] cashIn(double[] hedge, double[] price) {
        double[] cash = new double[hedge.length];
        for (int i = 0; i < hedge.length; i++) {
            cash[i] = -hedge[i] * price[i];
        }
        return cash;
    }
}
