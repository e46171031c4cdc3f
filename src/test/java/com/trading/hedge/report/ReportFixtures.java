package com.trading.hedge.report;

import java.time.LocalDate;
import java.util.List;

import com.trading.hedge.model.HedgeReport;
import com.trading.hedge.model.SensitivityPeriod;

final class ReportFixtures {

    private ReportFixtures() {
    }

    static HedgeReport spotAndTwoMonths() {
        SensitivityPeriod spot = SensitivityPeriod.builder()
                .commodity("GAS").date(null)
                .hedgeUnitsMean(-2).hedgeUnitsStderr(0.1)
                .priceMean(10).priceStd(1)
                .cashInMean(20).cashInStderr(1)
                .cumulativePositionMean(-2).cumulativePositionStderr(0.1)
                .cumulativeCashMean(20).cumulativeCashStderr(1)
                .totalUnitsStderr(Double.NaN)
                .build();
        SensitivityPeriod jan = SensitivityPeriod.builder()
                .commodity("GAS-2011-1").date(LocalDate.of(2011, 1, 1))
                .hedgeUnitsMean(-10).hedgeUnitsStderr(0.5)
                .priceMean(13.5).priceStd(2)
                .cashInMean(135).cashInStderr(4)
                .cumulativePositionMean(-10).cumulativePositionStderr(0.5)
                .cumulativeCashMean(135).cumulativeCashStderr(4)
                .totalUnitsStderr(0.5)
                .build();
        SensitivityPeriod feb = SensitivityPeriod.builder()
                .commodity("GAS-2011-2").date(LocalDate.of(2011, 2, 1))
                .hedgeUnitsMean(10).hedgeUnitsStderr(0.25)
                .priceMean(14).priceStd(2.5)
                .cashInMean(-140).cashInStderr(3)
                .cumulativePositionMean(0).cumulativePositionStderr(0.2)
                .cumulativeCashMean(-5).cumulativeCashStderr(1.5)
                .totalUnitsStderr(0.2)
                .build();
        return new HedgeReport(7.25, 0.05, List.of(spot, jan, feb));
    }
}
