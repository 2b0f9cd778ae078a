package com.flagship.budget_ledger.recurrence;

import com.flagship.budget_ledger.entry.EntryStore;
import com.flagship.budget_ledger.entry.StoreDates;
import com.flagship.budget_ledger.observability.CorrelationContext;
import com.flagship.budget_ledger.observability.LedgerMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Duration;
import java.time.LocalDate;
import java.util.Optional;

/**
 * Expands recurrence rules into concrete entries.
 *
 * Expansion resumes one step after the rule's cursor, writes every
 * occurrence through {@link EntryStore#insertForRule} (idempotent), and then
 * moves the cursor to the last occurrence produced. Calling it repeatedly
 * with a growing horizon therefore yields the same entries as a single call
 * to the largest horizon, and each call only touches new occurrences.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class RecurrenceEngine {

    private final RuleStore ruleStore;
    private final EntryStore entryStore;
    private final LedgerMetrics metrics;

    /**
     * Materializes every occurrence of the rule dated on or before the horizon.
     *
     * No-op when the rule does not exist or the horizon precedes the next
     * occurrence.
     *
     * @throws com.flagship.budget_ledger.error.LedgerException INVALID_DATE
     *         if the horizon is missing or outside the storable range
     *
     * @param ruleId  rule to expand
     * @param horizon last date (inclusive) to materialize
     * @return occurrences produced and the resulting cursor
     */
    @Transactional
    public GenerationResult generateUntil(long ruleId, LocalDate horizon) {
        StoreDates.requireStorable(horizon, "Horizon date");

        Optional<RecurrenceRule> found = ruleStore.findById(ruleId);
        if (found.isEmpty()) {
            log.debug("Rule {} not found, nothing to generate", ruleId);
            return GenerationResult.ruleNotFound(ruleId);
        }

        RecurrenceRule rule = found.get();
        long startTime = System.nanoTime();
        MDC.put(CorrelationContext.RULE_ID_MDC_KEY, String.valueOf(ruleId));
        try {
            LocalDate occurrence = RecurrenceSchedule.nextOccurrence(rule);
            LocalDate lastProduced = null;
            int produced = 0;

            while (!occurrence.isAfter(horizon)) {
                entryStore.insertForRule(occurrence, rule.getAmountMinorUnits(), rule.getNote(), ruleId);
                lastProduced = occurrence;
                produced++;
                occurrence = RecurrenceSchedule.advance(occurrence, rule.getEveryN(), rule.getUnit());
            }

            if (lastProduced == null) {
                return GenerationResult.of(ruleId, 0, rule.getLastGeneratedDate().orElse(null));
            }

            ruleStore.advanceCursor(ruleId, lastProduced);
            metrics.recordGeneration(produced, Duration.ofNanos(System.nanoTime() - startTime));
            log.info("Generated {} occurrence(s) for rule {} through {}", produced, ruleId, lastProduced);
            return GenerationResult.of(ruleId, produced, lastProduced);
        } finally {
            MDC.remove(CorrelationContext.RULE_ID_MDC_KEY);
        }
    }
}
