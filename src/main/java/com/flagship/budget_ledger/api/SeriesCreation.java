package com.flagship.budget_ledger.api;

import com.flagship.budget_ledger.reconciliation.ReconciliationOutcome;
import com.flagship.budget_ledger.recurrence.GenerationResult;
import com.flagship.budget_ledger.recurrence.RecurrenceRule;
import lombok.Value;

/**
 * Everything that happened when a recurring series was created:
 * the stored rule (with its cursor), how its start date was reconciled,
 * and what the first expansion produced.
 */
@Value
public class SeriesCreation {
    RecurrenceRule rule;
    ReconciliationOutcome reconciliation;
    GenerationResult generation;
}
