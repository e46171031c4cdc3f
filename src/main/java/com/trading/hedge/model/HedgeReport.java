package com.trading.hedge.model;

import java.util.ArrayList;
import java.util.List;

import lombok.Getter;

/**
 * Outcome of one aggregation: the fair value statistic and the per-period hedge
 * statistics. Spot periods come first, followed by dated periods in
 * chronological order.
 */
@Getter
public final class HedgeReport {
    private final double fairValueMean;
    private final double fairValueStderr;
    private final List<SensitivityPeriod> periods;

    public HedgeReport(double fairValueMean, double fairValueStderr, List<SensitivityPeriod> periods) {
        this.fairValueMean = fairValueMean;
        this.fairValueStderr = fairValueStderr;
        this.periods = List.copyOf(periods);
    }

    public List<SensitivityPeriod> spotPeriods() {
        List<SensitivityPeriod> out = new ArrayList<>();
        for (SensitivityPeriod p : periods) {
            if (p.isSpot()) {
                out.add(p);
            }
        }
        return out;
    }

    public List<SensitivityPeriod> datedPeriods() {
        List<SensitivityPeriod> out = new ArrayList<>();
        for (SensitivityPeriod p : periods) {
            if (!p.isSpot()) {
                out.add(p);
            }
        }
        return out;
    }

    /** The last reported period, which carries the net cash and net position; null if none. */
    public SensitivityPeriod lastPeriod() {
        return periods.isEmpty() ? null : periods.get(periods.size() - 1);
    }
}
