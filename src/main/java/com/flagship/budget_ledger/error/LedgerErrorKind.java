package com.flagship.budget_ledger.error;

/**
 * Classification of every failure the ledger reports to its callers.
 */
public enum LedgerErrorKind {
    /**
     * Recurrence unit outside day / week / month.
     */
    INVALID_UNIT,

    /**
     * Missing or malformed date, or a date range whose start follows its end.
     */
    INVALID_DATE,

    /**
     * Recurrence interval below 1.
     */
    NON_POSITIVE_INTERVAL,

    /**
     * Referenced entry or rule does not exist.
     */
    NOT_FOUND,

    /**
     * An update would give an entry the identity of another existing entry.
     */
    DUPLICATE_ENTRY,

    /**
     * The durable store failed; the operation in progress was rolled back.
     */
    STORAGE_FAILURE;

    public boolean isValidationError() {
        return this == INVALID_UNIT || this == INVALID_DATE || this == NON_POSITIVE_INTERVAL;
    }
}
