package com.trading.hedge.report;

import java.util.ArrayList;
import java.util.List;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.trading.hedge.error.HedgeAnalyticsException;
import com.trading.hedge.model.HedgeReport;
import com.trading.hedge.model.SensitivityPeriod;

import lombok.Data;

/**
 * JSON rendering of a {@link HedgeReport} for charting front ends. Dates are
 * rendered with the run's periodisation; non-finite numbers become strings
 * ("NaN", "Infinity") so the payload stays valid JSON.
 */
public final class JsonReportSerializer {
    private final ObjectMapper mapper;
    private final Periodisation periodisation;

    public JsonReportSerializer(Periodisation periodisation) {
        this.periodisation = periodisation;
        this.mapper = new ObjectMapper();
    }

    public String toJson(String title, HedgeReport report) {
        try {
            return mapper.writeValueAsString(toDocument(title, report));
        } catch (JsonProcessingException e) {
            throw new HedgeAnalyticsException("Failed to serialise hedge report '" + title + "'", e);
        }
    }

    ReportDocument toDocument(String title, HedgeReport report) {
        ReportDocument doc = new ReportDocument();
        doc.setTitle(title);
        doc.setPeriodisation(periodisation.tag());
        doc.setFairValueMean(report.getFairValueMean());
        doc.setFairValueStderr(report.getFairValueStderr());
        List<PeriodDocument> periods = new ArrayList<>(report.getPeriods().size());
        for (SensitivityPeriod p : report.getPeriods()) {
            PeriodDocument pd = new PeriodDocument();
            pd.setCommodity(p.getCommodity());
            pd.setDate(p.isSpot() ? null : periodisation.format(p.getDate()));
            pd.setHedgeUnitsMean(p.getHedgeUnitsMean());
            pd.setHedgeUnitsStderr(p.getHedgeUnitsStderr());
            pd.setPriceMean(p.getPriceMean());
            pd.setPriceStd(p.getPriceStd());
            pd.setCashInMean(p.getCashInMean());
            pd.setCashInStderr(p.getCashInStderr());
            pd.setCumPosMean(p.getCumulativePositionMean());
            pd.setCumPosStderr(p.getCumulativePositionStderr());
            pd.setCumCashMean(p.getCumulativeCashMean());
            pd.setCumCashStderr(p.getCumulativeCashStderr());
            pd.setTotalUnitsStderr(p.isSpot() ? null : p.getTotalUnitsStderr());
            periods.add(pd);
        }
        doc.setPeriods(periods);
        return doc;
    }

    @Data
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static final class ReportDocument {
        private String title, periodisation;
        private double fairValueMean, fairValueStderr;
        private List<PeriodDocument> periods;
    }

    @Data
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static final class PeriodDocument {
        private String commodity, date;
        private double hedgeUnitsMean, hedgeUnitsStderr;
        private double priceMean, priceStd;
        private double cashInMean, cashInStderr;
        private double cumPosMean, cumPosStderr;
        private double cumCashMean, cumCashStderr;
        private Double totalUnitsStderr;
    }
}
