package com.flagship.budget_ledger.recurrence;

import com.flagship.budget_ledger.error.LedgerException;

import java.util.Locale;

/**
 * Unit of a recurrence interval. The lowercase code is what gets persisted.
 */
public enum RecurrenceUnit {
    DAY("day"),
    WEEK("week"),
    MONTH("month");

    private final String code;

    RecurrenceUnit(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }

    /**
     * Parses a unit code, ignoring case and surrounding whitespace.
     *
     * @throws LedgerException INVALID_UNIT for anything but day, week or month
     */
    public static RecurrenceUnit fromCode(String code) {
        if (code == null) {
            throw LedgerException.invalidUnit(null);
        }
        String normalized = code.trim().toLowerCase(Locale.ROOT);
        for (RecurrenceUnit unit : values()) {
            if (unit.code.equals(normalized)) {
                return unit;
            }
        }
        throw LedgerException.invalidUnit(code);
    }
}
