package com.flagship.budget_ledger.error;

/**
 * Typed failure raised inside the engine.
 *
 * Validation failures are thrown before any write, so the surrounding
 * transaction has nothing to undo. The facade converts these into
 * {@link OperationResult} failures.
 */
public class LedgerException extends RuntimeException {

    private final LedgerErrorKind kind;

    public LedgerException(LedgerErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public LedgerErrorKind getKind() {
        return kind;
    }

    public static LedgerException invalidUnit(String unit) {
        return new LedgerException(LedgerErrorKind.INVALID_UNIT,
            String.format("Invalid recurrence unit '%s'. Expected one of: day, week, month", unit));
    }

    public static LedgerException invalidDate(String message) {
        return new LedgerException(LedgerErrorKind.INVALID_DATE, message);
    }

    public static LedgerException nonPositiveInterval(int everyN) {
        return new LedgerException(LedgerErrorKind.NON_POSITIVE_INTERVAL,
            "Recurrence interval must be at least 1, got " + everyN);
    }

    public static LedgerException entryNotFound(long entryId) {
        return new LedgerException(LedgerErrorKind.NOT_FOUND, "Entry not found: " + entryId);
    }

    public static LedgerException ruleNotFound(long ruleId) {
        return new LedgerException(LedgerErrorKind.NOT_FOUND, "Rule not found: " + ruleId);
    }
}
