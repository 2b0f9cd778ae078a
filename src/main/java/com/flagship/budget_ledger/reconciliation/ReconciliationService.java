package com.flagship.budget_ledger.reconciliation;

import com.flagship.budget_ledger.entry.Entry;
import com.flagship.budget_ledger.entry.EntryStore;
import com.flagship.budget_ledger.observability.LedgerMetrics;
import com.flagship.budget_ledger.recurrence.RecurrenceRule;
import com.flagship.budget_ledger.recurrence.RuleStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Optional;

/**
 * Merges a manually recorded entry into a newly created rule.
 *
 * When a user records an entry by hand and later turns it into a recurring
 * rule starting on the same day, the manual entry and the rule's first
 * occurrence describe the same money. Exactly one of them survives:
 * - If the rule already generated its start occurrence, the manual entry is deleted.
 * - Otherwise the manual entry is attached to the rule, keeping its id.
 *
 * Must run before the first expansion of the rule. Both branches execute in
 * one transaction.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ReconciliationService {

    private final RuleStore ruleStore;
    private final EntryStore entryStore;
    private final LedgerMetrics metrics;

    @Transactional
    public ReconciliationOutcome coalesceManualStart(long ruleId) {
        ReconciliationOutcome outcome = reconcile(ruleId);
        metrics.recordReconciliation(outcome.name());
        return outcome;
    }

    private ReconciliationOutcome reconcile(long ruleId) {
        Optional<RecurrenceRule> found = ruleStore.findById(ruleId);
        if (found.isEmpty()) {
            log.debug("Rule {} not found, nothing to reconcile", ruleId);
            return ReconciliationOutcome.RULE_NOT_FOUND;
        }
        RecurrenceRule rule = found.get();

        Optional<Entry> manual = entryStore.findManualMatch(
            rule.getStartDate(), rule.getAmountMinorUnits(), rule.getNote());
        if (manual.isEmpty()) {
            return ReconciliationOutcome.NO_MANUAL_ENTRY;
        }
        long manualId = manual.get().getId();

        Optional<Entry> generated = entryStore.findGeneratedMatch(
            rule.getStartDate(), rule.getAmountMinorUnits(), rule.getNote(), ruleId);
        if (generated.isPresent()) {
            entryStore.delete(manualId);
            log.info("Removed manual entry {}; rule {} already generated entry {} on {}",
                    manualId, ruleId, generated.get().getId(), rule.getStartDate());
            return ReconciliationOutcome.MANUAL_DELETED;
        }

        entryStore.attachToRule(manualId, ruleId);
        log.info("Attached manual entry {} to rule {} as its {} occurrence",
                manualId, ruleId, rule.getStartDate());
        return ReconciliationOutcome.MANUAL_REPARENTED;
    }
}
