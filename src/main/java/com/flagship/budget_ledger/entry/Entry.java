package com.flagship.budget_ledger.entry;

import lombok.Value;

import java.time.LocalDate;
import java.util.Optional;

/**
 * A single ledger line, populated once at the storage boundary.
 *
 * Amounts are signed integer minor units (e.g. cents). An absent rule
 * reference marks a manually-created entry; a present one marks an entry
 * generated by that recurrence rule.
 */
@Value
public class Entry {
    long id;
    LocalDate date;
    long amountMinorUnits;
    String note;
    Long ruleId;

    public Optional<Long> getRuleId() {
        return Optional.ofNullable(ruleId);
    }

    public boolean isGenerated() {
        return ruleId != null;
    }

    public boolean isManual() {
        return ruleId == null;
    }
}
