package com.flagship.budget_ledger.recurrence;

import com.flagship.budget_ledger.observability.LedgerMetrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.time.YearMonth;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Keeps every rule expanded out to a far horizon.
 *
 * Remembers the furthest horizon to which all rules were extended so that
 * repeated month views do not re-run expansion. The remembered horizon is
 * only a shortcut: it is cleared whenever a rule is created or deleted, and
 * the next extension then re-derives progress from each rule's stored cursor.
 */
@Service
@Slf4j
public class HorizonService {

    private final RuleStore ruleStore;
    private final RecurrenceEngine recurrenceEngine;
    private final LedgerMetrics metrics;
    private final int horizonMonths;

    private final AtomicReference<LocalDate> generatedThrough = new AtomicReference<>();

    public HorizonService(RuleStore ruleStore,
                          RecurrenceEngine recurrenceEngine,
                          LedgerMetrics metrics,
                          @Value("${ledger.recurrence.horizon-months:12}") int horizonMonths) {
        if (horizonMonths < 0) {
            throw new IllegalArgumentException("ledger.recurrence.horizon-months must not be negative");
        }
        this.ruleStore = ruleStore;
        this.recurrenceEngine = recurrenceEngine;
        this.metrics = metrics;
        this.horizonMonths = horizonMonths;
    }

    /**
     * Last day of the month {@code horizon-months} after the reference month.
     */
    public LocalDate farHorizon(YearMonth referenceMonth) {
        return referenceMonth.plusMonths(horizonMonths).atEndOfMonth();
    }

    /**
     * Extends every rule through the far horizon of the given month.
     *
     * @return true if expansion ran, false if the cached horizon already covered it
     */
    public boolean extendForMonth(YearMonth referenceMonth) {
        return extendAllTo(farHorizon(referenceMonth));
    }

    /**
     * Extends every rule through the horizon unless a previous call already did.
     *
     * @return true if expansion ran, false if the cached horizon already covered it
     */
    public boolean extendAllTo(LocalDate horizon) {
        LocalDate cached = generatedThrough.get();
        if (cached != null && !horizon.isAfter(cached)) {
            metrics.recordHorizonCacheHit();
            return false;
        }

        metrics.recordHorizonCacheMiss();
        int produced = 0;
        for (RecurrenceRule rule : ruleStore.findAll()) {
            produced += recurrenceEngine.generateUntil(rule.getId(), horizon).getOccurrencesProduced();
        }
        generatedThrough.accumulateAndGet(horizon,
            (current, requested) -> current == null || requested.isAfter(current) ? requested : current);
        log.info("Extended all rules through {} ({} new occurrence(s))", horizon, produced);
        return true;
    }

    /**
     * Forgets the cached horizon. Must be called after a rule is created or deleted.
     */
    public void invalidate() {
        generatedThrough.set(null);
        log.debug("Horizon cache invalidated");
    }

    public Optional<LocalDate> cachedHorizon() {
        return Optional.ofNullable(generatedThrough.get());
    }

    public int getHorizonMonths() {
        return horizonMonths;
    }
}
