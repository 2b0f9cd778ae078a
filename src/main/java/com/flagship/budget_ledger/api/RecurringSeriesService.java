package com.flagship.budget_ledger.api;

import com.flagship.budget_ledger.reconciliation.ReconciliationOutcome;
import com.flagship.budget_ledger.reconciliation.ReconciliationService;
import com.flagship.budget_ledger.recurrence.GenerationResult;
import com.flagship.budget_ledger.recurrence.HorizonService;
import com.flagship.budget_ledger.recurrence.RecurrenceEngine;
import com.flagship.budget_ledger.recurrence.RecurrenceRule;
import com.flagship.budget_ledger.recurrence.RecurrenceUnit;
import com.flagship.budget_ledger.recurrence.RuleStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDate;
import java.time.YearMonth;

/**
 * Creates a recurring series in one transaction.
 *
 * Order matters:
 * 1. Create the rule
 * 2. Reconcile a manual entry already recorded on the start date
 * 3. Expand the rule through the far horizon of the reference month
 *
 * Reconciling before the first expansion means the manual entry is
 * re-parented rather than duplicated, and it keeps its id.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class RecurringSeriesService {

    private final RuleStore ruleStore;
    private final ReconciliationService reconciliationService;
    private final RecurrenceEngine recurrenceEngine;
    private final HorizonService horizonService;

    @Transactional
    public SeriesCreation createSeries(LocalDate startDate, long amountMinorUnits, String note,
                                       int everyN, RecurrenceUnit unit, YearMonth referenceMonth) {
        RecurrenceRule rule = ruleStore.create(startDate, amountMinorUnits, note, everyN, unit);

        ReconciliationOutcome reconciliation = reconciliationService.coalesceManualStart(rule.getId());

        LocalDate horizon = horizonService.farHorizon(referenceMonth);
        GenerationResult generation = recurrenceEngine.generateUntil(rule.getId(), horizon);

        RecurrenceRule stored = ruleStore.findById(rule.getId())
            .orElseThrow(() -> new IllegalStateException("Rule vanished during creation: " + rule.getId()));

        log.info("Created series for rule {}: reconciliation={}, {} occurrence(s) through {}",
                rule.getId(), reconciliation, generation.getOccurrencesProduced(), horizon);
        return new SeriesCreation(stored, reconciliation, generation);
    }
}
