package com.holdingsledger.common;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;

/**
 * Calendar-day arithmetic for holding periods and wash-sale windows.
 */
public final class DayCounts {

    private DayCounts() {
    }

    /** Whole calendar days from {@code from} to {@code to}; negative when {@code to} precedes {@code from}. */
    public static long signedDaysBetween(LocalDate from, LocalDate to) {
        return ChronoUnit.DAYS.between(from, to);
    }

    /** Absolute number of calendar days separating the two dates. */
    public static long daysApart(LocalDate a, LocalDate b) {
        return Math.abs(signedDaysBetween(a, b));
    }

    /**
     * Long-term iff strictly more than {@code thresholdDays} days separate acquisition and sale.
     * Exactly {@code thresholdDays} is still short-term.
     */
    public static boolean isLongTerm(LocalDate acquiredDate, LocalDate soldDate, long thresholdDays) {
        return daysApart(acquiredDate, soldDate) > thresholdDays;
    }
}
