package com.flagship.budget_ledger.recurrence;

import lombok.Value;

import java.time.LocalDate;
import java.util.Optional;

/**
 * Domain model for a recurrence rule: a template that generates entries
 * every {@code everyN} units starting at {@code startDate}.
 *
 * {@code lastGeneratedDate} is the expansion cursor: the date of the most
 * recently materialized occurrence, absent until the first expansion.
 */
@Value
public class RecurrenceRule {
    long id;
    LocalDate startDate;
    long amountMinorUnits;
    String note;
    int everyN;
    RecurrenceUnit unit;
    LocalDate lastGeneratedDate;

    public Optional<LocalDate> getLastGeneratedDate() {
        return Optional.ofNullable(lastGeneratedDate);
    }
}
