package com.trading.hedge.model;

import java.time.DateTimeException;
import java.time.LocalDate;
import java.util.Arrays;
import java.util.Comparator;

/**
 * Identifies one perturbed valuation.
 *
 * Two shapes are recognised:
 * <ul>
 * <li>{@code GAS} - a bare commodity name, the spot (non-dated) bucket.</li>
 * <li>{@code OIL-2020-1} or {@code OIL-2020-1-15} - commodity, year, month and
 * optional day of a dated bucket. The day defaults to 1.</li>
 * </ul>
 * The downward perturbation of a key is stored under the same text prefixed
 * with {@link #NEGATION_PREFIX}.
 */
public final class PerturbationKey {
    public static final String NEGATION_PREFIX = "-";
    public static final char SEPARATOR = '-';

    /** Orders keys by their numeric (year, month, day) suffix, then commodity. */
    public static final Comparator<PerturbationKey> CHRONOLOGICAL = (a, b) -> {
        int c = Arrays.compare(a.dateParts, b.dateParts);
        return c != 0 ? c : a.commodity.compareTo(b.commodity);
    };

    private final String text;
    private final String commodity;
    // Empty for spot keys; {year, month} or {year, month, day} otherwise.
    private final int[] dateParts;
    private final LocalDate date;

    private PerturbationKey(String text, String commodity, int[] dateParts, LocalDate date) {
        this.text = text;
        this.commodity = commodity;
        this.dateParts = dateParts;
        this.date = date;
    }

    public static boolean isNegated(String rawKey) {
        return rawKey.startsWith(NEGATION_PREFIX);
    }

    /**
     * True for a key with exactly one suffix after the commodity, such as
     * {@code OIL-2020}. Such keys are neither spot nor dated and are left out
     * of aggregation.
     */
    public static boolean isPartiallyDated(String rawKey) {
        return rawKey.split(String.valueOf(SEPARATOR), -1).length == 2;
    }

    /**
     * Parses a non-negated key.
     *
     * @throws IllegalArgumentException if the key is negated, has a single
     *                                  numeric suffix, a non-numeric suffix or
     *                                  an impossible date.
     */
    public static PerturbationKey parse(String rawKey) {
        if (rawKey == null || rawKey.isEmpty()) {
            throw new IllegalArgumentException("Perturbation key must not be empty");
        }
        if (isNegated(rawKey)) {
            throw new IllegalArgumentException("Expected a non-negated perturbation key: " + rawKey);
        }

        String[] parts = rawKey.split(String.valueOf(SEPARATOR), -1);
        String commodity = parts[0];
        if (commodity.isEmpty()) {
            throw new IllegalArgumentException("Missing commodity in perturbation key: " + rawKey);
        }
        if (parts.length == 1) {
            return new PerturbationKey(rawKey, commodity, new int[0], null);
        }
        if (parts.length < 3 || parts.length > 4) {
            throw new IllegalArgumentException(
                    "Unrecognised perturbation key '" + rawKey + "' (expected NAME or NAME-YEAR-MONTH[-DAY])");
        }

        int[] dateParts = new int[parts.length - 1];
        for (int i = 1; i < parts.length; i++) {
            try {
                dateParts[i - 1] = Integer.parseInt(parts[i]);
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Non-numeric date component in perturbation key: " + rawKey, e);
            }
        }

        LocalDate date;
        try {
            date = LocalDate.of(dateParts[0], dateParts[1], dateParts.length > 2 ? dateParts[2] : 1);
        } catch (DateTimeException e) {
            throw new IllegalArgumentException("Invalid date in perturbation key: " + rawKey, e);
        }
        return new PerturbationKey(rawKey, commodity, dateParts, date);
    }

    public String text() {
        return text;
    }

    /** Key of the downward perturbation. */
    public String negatedText() {
        return NEGATION_PREFIX + text;
    }

    public String commodity() {
        return commodity;
    }

    public boolean isSpot() {
        return date == null;
    }

    /** @return the bucket date, or null for a spot key. */
    public LocalDate date() {
        return date;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof PerturbationKey other && text.equals(other.text);
    }

    @Override
    public int hashCode() {
        return text.hashCode();
    }

    @Override
    public String toString() {
        return text;
    }
}
