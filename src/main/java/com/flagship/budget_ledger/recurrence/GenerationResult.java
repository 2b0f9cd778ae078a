package com.flagship.budget_ledger.recurrence;

import lombok.Value;

import java.time.LocalDate;
import java.util.Optional;

/**
 * Result of expanding one rule up to a horizon.
 */
@Value
public class GenerationResult {
    long ruleId;
    boolean ruleFound;
    int occurrencesProduced;
    LocalDate cursor;

    public static GenerationResult ruleNotFound(long ruleId) {
        return new GenerationResult(ruleId, false, 0, null);
    }

    public static GenerationResult of(long ruleId, int occurrencesProduced, LocalDate cursor) {
        return new GenerationResult(ruleId, true, occurrencesProduced, cursor);
    }

    /**
     * Cursor after the call: last materialized occurrence, if any.
     */
    public Optional<LocalDate> getCursor() {
        return Optional.ofNullable(cursor);
    }
}
