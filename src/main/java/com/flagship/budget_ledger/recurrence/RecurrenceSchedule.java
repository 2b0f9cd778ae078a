package com.flagship.budget_ledger.recurrence;

import com.flagship.budget_ledger.error.LedgerException;

import java.time.LocalDate;
import java.util.Objects;

/**
 * Date arithmetic for recurrence rules.
 *
 * Month steps clamp the day-of-month to the last day of the target month
 * (Jan 31 + 1 month = Feb 28, or Feb 29 in a leap year). java.time uses the
 * proleptic Gregorian calendar, so leap years follow the 4/100/400 rule.
 */
public final class RecurrenceSchedule {

    private RecurrenceSchedule() {
        // Utility class
    }

    /**
     * Returns the occurrence that follows {@code date}.
     */
    public static LocalDate advance(LocalDate date, int everyN, RecurrenceUnit unit) {
        Objects.requireNonNull(date, "date");
        Objects.requireNonNull(unit, "unit");
        if (everyN < 1) {
            throw LedgerException.nonPositiveInterval(everyN);
        }

        return switch (unit) {
            case DAY -> date.plusDays(everyN);
            case WEEK -> date.plusWeeks(everyN);
            case MONTH -> date.plusMonths(everyN);
        };
    }

    /**
     * First occurrence that has not been materialized yet: the start date when
     * nothing was generated, otherwise one step after the cursor.
     */
    public static LocalDate nextOccurrence(RecurrenceRule rule) {
        return rule.getLastGeneratedDate()
            .map(cursor -> advance(cursor, rule.getEveryN(), rule.getUnit()))
            .orElse(rule.getStartDate());
    }
}
