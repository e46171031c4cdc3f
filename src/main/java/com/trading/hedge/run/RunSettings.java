package com.trading.hedge.run;

import java.time.Duration;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.trading.hedge.progress.ProgressSettings;
import com.trading.hedge.report.Periodisation;

import lombok.Data;

/**
 * Parameters of one hedge valuation run, typically loaded from JSON by
 * {@link RunSettingsLoader}.
 *
 * <pre>
 * {
 *   "title": "Gas storage",
 *   "sourceCode": "...",
 *   "observationDate": "2011-01-01",
 *   "interestRate": 2.5,
 *   "pathCount": 20000,
 *   "perturbationFactor": 0.01,
 *   "priceProcess": { "name": "quantdsl.priceprocess.blackscholes.BlackScholesPriceProcess", ... },
 *   "periodisation": "monthly"
 * }
 * </pre>
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public final class RunSettings {
    private String title = "Hedge valuation";
    private String sourceCode;
    private String observationDate;
    private double interestRate;
    private int pathCount;
    private double perturbationFactor;
    private Map<String, Object> priceProcess;
    private String periodisation = Periodisation.MONTHLY.tag();

    // Synchronisation
    private long pollTimeoutMillis = 2000;
    private long totalBudgetMillis; // 0 = wait indefinitely

    // Telemetry smoothing
    private double windowFraction = ProgressSettings.DEFAULT_WINDOW_FRACTION;
    private double fallbackRate = ProgressSettings.DEFAULT_FALLBACK_RATE;
    private long progressLogIntervalMillis = 1000;

    /**
     * Checks required fields and resolves the periodisation so configuration
     * errors surface before any work starts.
     *
     * @throws IllegalArgumentException for missing or invalid values.
     * @throws com.trading.hedge.error.UnknownPeriodisationException for an
     *         unsupported periodisation tag.
     */
    public void validate() {
        if (sourceCode == null || sourceCode.isBlank()) {
            throw new IllegalArgumentException("sourceCode is required");
        }
        if (pathCount <= 0) {
            throw new IllegalArgumentException("pathCount must be positive: " + pathCount);
        }
        if (priceProcess == null || !(priceProcess.get("name") instanceof String)) {
            throw new IllegalArgumentException("priceProcess.name is required");
        }
        if (pollTimeoutMillis <= 0) {
            throw new IllegalArgumentException("pollTimeoutMillis must be positive: " + pollTimeoutMillis);
        }
        if (totalBudgetMillis < 0) {
            throw new IllegalArgumentException("totalBudgetMillis must be >= 0: " + totalBudgetMillis);
        }
        parsedObservationDate();
        resolvePeriodisation();
        toProgressSettings();
    }

    public LocalDate parsedObservationDate() {
        if (observationDate == null) {
            throw new IllegalArgumentException("observationDate is required");
        }
        try {
            return LocalDate.parse(observationDate.trim());
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException("Invalid observationDate: " + observationDate, e);
        }
    }

    public Periodisation resolvePeriodisation() {
        return Periodisation.fromTag(periodisation);
    }

    public String priceProcessName() {
        return (String) priceProcess.get("name");
    }

    public Duration pollTimeout() {
        return Duration.ofMillis(pollTimeoutMillis);
    }

    /** @return the total wait budget, or null when unbounded. */
    public Duration totalBudget() {
        return totalBudgetMillis == 0 ? null : Duration.ofMillis(totalBudgetMillis);
    }

    public ProgressSettings toProgressSettings() {
        return new ProgressSettings(windowFraction, fallbackRate);
    }
}
