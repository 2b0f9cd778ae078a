package com.flagship.budget_ledger.reconciliation;

/**
 * What reconciling a rule's start date did.
 */
public enum ReconciliationOutcome {
    RULE_NOT_FOUND,
    NO_MANUAL_ENTRY,

    /**
     * The rule had already generated its start occurrence; the manual twin was removed.
     */
    MANUAL_DELETED,

    /**
     * The manual entry now belongs to the rule and keeps its id.
     */
    MANUAL_REPARENTED;

    public boolean changedLedger() {
        return this == MANUAL_DELETED || this == MANUAL_REPARENTED;
    }
}
