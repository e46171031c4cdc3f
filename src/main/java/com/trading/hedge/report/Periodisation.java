package com.trading.hedge.report;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.Locale;

import com.trading.hedge.error.UnknownPeriodisationException;

/** Granularity at which period dates are rendered. */
public enum Periodisation {
    DAILY("daily", DateTimeFormatter.ofPattern("yyyy-MM-dd")),
    MONTHLY("monthly", DateTimeFormatter.ofPattern("yyyy-MM"));

    private final String tag;
    private final DateTimeFormatter formatter;

    Periodisation(String tag, DateTimeFormatter formatter) {
        this.tag = tag;
        this.formatter = formatter;
    }

    /**
     * @throws UnknownPeriodisationException for anything but "daily" or
     *                                       "monthly" (case-insensitive).
     */
    public static Periodisation fromTag(String tag) {
        if (tag != null) {
            String normalized = tag.trim().toLowerCase(Locale.ROOT);
            for (Periodisation p : values()) {
                if (p.tag.equals(normalized)) {
                    return p;
                }
            }
        }
        throw new UnknownPeriodisationException(tag);
    }

    public String tag() {
        return tag;
    }

    /** Formats a period date; the spot bucket (null date) renders as "spot". */
    public String format(LocalDate date) {
        return date == null ? "spot" : formatter.format(date);
    }
}
