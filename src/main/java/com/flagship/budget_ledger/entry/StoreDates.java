package com.flagship.budget_ledger.entry;

import com.flagship.budget_ledger.error.LedgerException;

import java.time.LocalDate;

/**
 * Calendar range the ledger accepts: years 1 through 9999.
 *
 * PostgreSQL's date type reaches further in both directions, but dates at
 * the edges of java.time cannot be stepped (a range seeded from the day
 * before LocalDate.MIN overflows), so anything outside four-digit years is
 * rejected as INVALID_DATE before it reaches the store.
 */
public final class StoreDates {

    public static final LocalDate EARLIEST = LocalDate.of(1, 1, 1);
    public static final LocalDate LATEST = LocalDate.of(9999, 12, 31);

    private StoreDates() {
        // Utility class
    }

    /**
     * @throws LedgerException INVALID_DATE if the date is missing or outside the accepted range
     */
    public static LocalDate requireStorable(LocalDate date, String field) {
        if (date == null) {
            throw LedgerException.invalidDate(field + " is required");
        }
        if (date.isBefore(EARLIEST) || date.isAfter(LATEST)) {
            throw LedgerException.invalidDate(
                String.format("%s %s is outside the supported range %s..%s", field, date, EARLIEST, LATEST));
        }
        return date;
    }
}
