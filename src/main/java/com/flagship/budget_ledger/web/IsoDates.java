package com.flagship.budget_ledger.web;

import com.flagship.budget_ledger.entry.StoreDates;
import com.flagship.budget_ledger.error.LedgerException;

import java.time.LocalDate;
import java.time.YearMonth;
import java.time.format.DateTimeParseException;

/**
 * Parses the ISO date strings accepted at the HTTP boundary.
 * Malformed input, and dates outside the years the ledger stores, are
 * INVALID_DATE ledger errors rather than a generic 400.
 */
final class IsoDates {

    private IsoDates() {
    }

    static LocalDate parseDate(String value, String field) {
        if (value == null || value.isBlank()) {
            throw LedgerException.invalidDate(field + " is required");
        }
        try {
            return StoreDates.requireStorable(LocalDate.parse(value.trim()), field);
        } catch (DateTimeParseException e) {
            throw LedgerException.invalidDate(field + " must be an ISO date (YYYY-MM-DD), got '" + value + "'");
        }
    }

    static YearMonth parseMonth(String value, String field) {
        if (value == null || value.isBlank()) {
            throw LedgerException.invalidDate(field + " is required");
        }
        YearMonth month;
        try {
            month = YearMonth.parse(value.trim());
        } catch (DateTimeParseException e) {
            throw LedgerException.invalidDate(field + " must be a month (YYYY-MM), got '" + value + "'");
        }
        StoreDates.requireStorable(month.atDay(1), field);
        return month;
    }

    /**
     * Optional month: null or blank yields null.
     */
    static YearMonth parseOptionalMonth(String value, String field) {
        if (value == null || value.isBlank()) {
            return null;
        }
        return parseMonth(value, field);
    }
}
