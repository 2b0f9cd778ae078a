package com.flagship.budget_ledger.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Centralized metrics for ledger and recurrence operations.
 *
 * Metrics exposed:
 * - ledger.entries.inserted: rows actually written by insert
 * - ledger.entries.deduplicated: inserts resolved to an existing row
 * - ledger.recurrence.generated: occurrences materialized by rule expansion
 * - ledger.recurrence.duration: time spent in a single rule expansion
 * - ledger.reconciliation: reconciliation outcomes, tagged by outcome
 * - ledger.horizon.cache: horizon cache lookups, tagged hit / miss
 * - ledger.operations.failed: facade failures, tagged by error kind
 */
@Component
public class LedgerMetrics {

    private final MeterRegistry registry;

    private final Counter entriesInserted;
    private final Counter entriesDeduplicated;
    private final Counter occurrencesGenerated;
    private final Timer generationTimer;

    public LedgerMetrics(MeterRegistry registry) {
        this.registry = registry;

        this.entriesInserted = Counter.builder("ledger.entries.inserted")
                .description("Number of entries written to the ledger")
                .register(registry);

        this.entriesDeduplicated = Counter.builder("ledger.entries.deduplicated")
                .description("Number of inserts that resolved to an existing entry")
                .register(registry);

        this.occurrencesGenerated = Counter.builder("ledger.recurrence.generated")
                .description("Number of occurrences materialized from recurrence rules")
                .register(registry);

        this.generationTimer = Timer.builder("ledger.recurrence.duration")
                .description("Time taken to expand a single rule")
                .publishPercentiles(0.5, 0.95, 0.99)
                .register(registry);
    }

    public void recordInsert(boolean created) {
        if (created) {
            entriesInserted.increment();
        } else {
            entriesDeduplicated.increment();
        }
    }

    public void recordGeneration(int occurrences, Duration duration) {
        occurrencesGenerated.increment(occurrences);
        generationTimer.record(duration);
    }

    public void recordReconciliation(String outcome) {
        registry.counter("ledger.reconciliation", "outcome", sanitizeTag(outcome)).increment();
    }

    public void recordHorizonCacheHit() {
        registry.counter("ledger.horizon.cache", "result", "hit").increment();
    }

    public void recordHorizonCacheMiss() {
        registry.counter("ledger.horizon.cache", "result", "miss").increment();
    }

    public void recordFailure(String operation, String errorKind) {
        registry.counter("ledger.operations.failed",
                "operation", sanitizeTag(operation),
                "kind", sanitizeTag(errorKind)
        ).increment();
    }

    private String sanitizeTag(String value) {
        if (value == null || value.isBlank()) {
            return "unknown";
        }
        return value.toLowerCase().replaceAll("[^a-z0-9_]", "_");
    }
}
