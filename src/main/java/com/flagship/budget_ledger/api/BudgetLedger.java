package com.flagship.budget_ledger.api;

import com.flagship.budget_ledger.balance.BalanceCalculator;
import com.flagship.budget_ledger.balance.DailyBalance;
import com.flagship.budget_ledger.entry.Entry;
import com.flagship.budget_ledger.entry.EntryStore;
import com.flagship.budget_ledger.entry.StoreDates;
import com.flagship.budget_ledger.error.LedgerErrorKind;
import com.flagship.budget_ledger.error.LedgerException;
import com.flagship.budget_ledger.error.OperationResult;
import com.flagship.budget_ledger.observability.CorrelationContext;
import com.flagship.budget_ledger.observability.LedgerMetrics;
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
import org.slf4j.MDC;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.TransactionException;

import java.time.DateTimeException;
import java.time.LocalDate;
import java.time.YearMonth;
import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * The ledger's public surface.
 *
 * Every mutating operation returns an {@link OperationResult}: validation
 * errors, missing records, update collisions and storage failures are all
 * classified into a {@link LedgerErrorKind} instead of escaping as
 * exceptions. Dates outside {@link StoreDates} are INVALID_DATE, as is any
 * date arithmetic that overflows java.time. Each operation delegates to exactly one transactional service
 * call, so a failure has already been rolled back when it is reported here.
 *
 * Rule creation and deletion clear the horizon cache.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class BudgetLedger {

    private final EntryStore entryStore;
    private final RuleStore ruleStore;
    private final RecurrenceEngine recurrenceEngine;
    private final ReconciliationService reconciliationService;
    private final RecurringSeriesService recurringSeriesService;
    private final BalanceCalculator balanceCalculator;
    private final HorizonService horizonService;
    private final LedgerMetrics metrics;

    // ==================== Entries ====================

    /**
     * Records a manual entry. Returns the id of the identical manual entry if one exists.
     */
    public OperationResult<Long> insert(LocalDate date, long amountMinorUnits, String note) {
        return execute("insert", () -> {
            StoreDates.requireStorable(date, "Entry date");
            return entryStore.insertManual(date, amountMinorUnits, normalizeNote(note));
        });
    }

    /**
     * Records an entry that belongs to a rule. Returns the id of the identical
     * entry if one exists.
     */
    public OperationResult<Long> insert(LocalDate date, long amountMinorUnits, String note, long ruleId) {
        return execute("insert", () -> {
            StoreDates.requireStorable(date, "Entry date");
            if (!ruleStore.exists(ruleId)) {
                throw LedgerException.ruleNotFound(ruleId);
            }
            return entryStore.insertForRule(date, amountMinorUnits, normalizeNote(note), ruleId);
        });
    }

    public OperationResult<Entry> update(long entryId, LocalDate date, long amountMinorUnits, String note) {
        return execute("update", () -> {
            StoreDates.requireStorable(date, "Entry date");
            MDC.put(CorrelationContext.ENTRY_ID_MDC_KEY, String.valueOf(entryId));
            try {
                return entryStore.update(entryId, date, amountMinorUnits, normalizeNote(note));
            } finally {
                MDC.remove(CorrelationContext.ENTRY_ID_MDC_KEY);
            }
        });
    }

    /**
     * Deletes one entry. Succeeds when the entry is already gone; the value
     * tells whether a row was removed.
     */
    public OperationResult<Boolean> delete(long entryId) {
        return execute("delete", () -> entryStore.delete(entryId));
    }

    public List<Entry> listByDate(LocalDate date) {
        StoreDates.requireStorable(date, "Date");
        return entryStore.listByDate(date);
    }

    public Optional<Entry> get(long entryId) {
        return entryStore.get(entryId);
    }

    public long runningBalanceThrough(LocalDate date) {
        return balanceCalculator.balanceThrough(date);
    }

    // ==================== Rules ====================

    /**
     * Creates a rule without expanding it.
     *
     * @param unit "day", "week" or "month"
     */
    public OperationResult<Long> createRule(LocalDate startDate, long amountMinorUnits, String note,
                                            int everyN, String unit) {
        OperationResult<Long> result = execute("create_rule", () -> {
            RecurrenceUnit recurrenceUnit = RecurrenceUnit.fromCode(unit);
            return ruleStore.create(startDate, amountMinorUnits, normalizeNote(note), everyN, recurrenceUnit);
        }).map(RecurrenceRule::getId);
        if (result.isSuccess()) {
            horizonService.invalidate();
        }
        return result;
    }

    /**
     * Creates a rule, reconciles a manual entry on its start date, and expands
     * it through the far horizon of the reference month, as one unit.
     *
     * @param referenceMonth month the caller is looking at; null means the later
     *                       of the current month and the start month
     */
    public OperationResult<SeriesCreation> createRecurringEntry(LocalDate startDate, long amountMinorUnits,
                                                                String note, int everyN, String unit,
                                                                YearMonth referenceMonth) {
        OperationResult<SeriesCreation> result = execute("create_series", () -> {
            StoreDates.requireStorable(startDate, "Rule start date");
            RecurrenceUnit recurrenceUnit = RecurrenceUnit.fromCode(unit);
            YearMonth reference = referenceMonth != null ? referenceMonth : defaultReferenceMonth(startDate);
            return recurringSeriesService.createSeries(
                startDate, amountMinorUnits, normalizeNote(note), everyN, recurrenceUnit, reference);
        });
        if (result.isSuccess()) {
            horizonService.invalidate();
        }
        return result;
    }

    /**
     * Expands a rule through the horizon. A missing rule is a no-op, reported
     * through {@link GenerationResult#isRuleFound()}.
     */
    public OperationResult<GenerationResult> generateUntil(long ruleId, LocalDate horizon) {
        return execute("generate", () -> recurrenceEngine.generateUntil(ruleId, horizon));
    }

    public OperationResult<ReconciliationOutcome> coalesceManualStart(long ruleId) {
        return execute("coalesce", () -> reconciliationService.coalesceManualStart(ruleId));
    }

    /**
     * Deletes a rule and all of its entries. Succeeds when the rule is already
     * gone; the value is the number of entries removed.
     */
    public OperationResult<Integer> deleteRuleAndEntries(long ruleId) {
        OperationResult<Integer> result = execute("delete_rule", () -> ruleStore.deleteRuleAndEntries(ruleId));
        if (result.isSuccess()) {
            horizonService.invalidate();
        }
        return result;
    }

    public List<RecurrenceRule> listRules() {
        return ruleStore.findAll();
    }

    public Optional<RecurrenceRule> getRule(long ruleId) {
        return ruleStore.findById(ruleId);
    }

    public List<Entry> listEntriesForRule(long ruleId) {
        return entryStore.listByRule(ruleId);
    }

    // ==================== Balances ====================

    public OperationResult<List<DailyBalance>> runningBalances(LocalDate from, LocalDate to) {
        return execute("running_balances", () -> balanceCalculator.runningBalances(from, to));
    }

    /**
     * Daily balances for a month, after making sure every rule is expanded
     * through that month's far horizon.
     */
    public OperationResult<List<DailyBalance>> monthBalances(YearMonth month) {
        return execute("month_balances", () -> {
            if (month == null) {
                throw LedgerException.invalidDate("Month is required");
            }
            horizonService.extendForMonth(month);
            return balanceCalculator.monthBalances(month);
        });
    }

    // ==================== Helpers ====================

    private <T> OperationResult<T> execute(String operation, Supplier<T> action) {
        try {
            return OperationResult.success(action.get());
        } catch (LedgerException e) {
            log.warn("{} rejected: kind={}, message={}", operation, e.getKind(), e.getMessage());
            return failure(operation, e);
        } catch (DateTimeException e) {
            log.warn("{} rejected: date out of range: {}", operation, e.getMessage());
            return failure(operation, LedgerException.invalidDate("Date out of range: " + e.getMessage()));
        } catch (DuplicateKeyException e) {
            log.warn("{} rejected: would duplicate an existing entry", operation);
            return failure(operation, new LedgerException(LedgerErrorKind.DUPLICATE_ENTRY,
                "Another entry already has this date, amount and note"));
        } catch (DataAccessException | TransactionException e) {
            log.error("{} failed in the store", operation, e);
            return failure(operation, new LedgerException(LedgerErrorKind.STORAGE_FAILURE,
                "Storage failure: " + e.getMostSpecificCause().getMessage()));
        }
    }

    private <T> OperationResult<T> failure(String operation, LedgerException e) {
        metrics.recordFailure(operation, e.getKind().name());
        return OperationResult.failure(e);
    }

    private static String normalizeNote(String note) {
        return note == null ? "" : note;
    }

    private static YearMonth defaultReferenceMonth(LocalDate startDate) {
        YearMonth current = YearMonth.now();
        YearMonth start = YearMonth.from(startDate);
        return start.isAfter(current) ? start : current;
    }
}
