package com.flagship.budget_ledger.api;

import com.flagship.budget_ledger.balance.BalanceCalculator;
import com.flagship.budget_ledger.balance.DailyBalance;
import com.flagship.budget_ledger.entry.EntryStore;
import com.flagship.budget_ledger.error.LedgerErrorKind;
import com.flagship.budget_ledger.error.OperationResult;
import com.flagship.budget_ledger.observability.LedgerMetrics;
import com.flagship.budget_ledger.reconciliation.ReconciliationService;
import com.flagship.budget_ledger.recurrence.GenerationResult;
import com.flagship.budget_ledger.recurrence.HorizonService;
import com.flagship.budget_ledger.recurrence.RecurrenceEngine;
import com.flagship.budget_ledger.recurrence.RuleStore;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.dao.DataAccessResourceFailureException;

import java.time.DateTimeException;
import java.time.LocalDate;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

/**
 * Failure classification of the facade, without a database: every exception
 * the collaborators can raise must come back as a typed result.
 */
class BudgetLedgerErrorMappingTest {

    private EntryStore entryStore;
    private RuleStore ruleStore;
    private RecurrenceEngine recurrenceEngine;
    private SimpleMeterRegistry registry;
    private BudgetLedger ledger;

    @BeforeEach
    void setUp() {
        entryStore = mock(EntryStore.class);
        ruleStore = mock(RuleStore.class);
        recurrenceEngine = mock(RecurrenceEngine.class);
        registry = new SimpleMeterRegistry();

        ledger = new BudgetLedger(
            entryStore,
            ruleStore,
            recurrenceEngine,
            mock(ReconciliationService.class),
            mock(RecurringSeriesService.class),
            new BalanceCalculator(entryStore),
            mock(HorizonService.class),
            new LedgerMetrics(registry)
        );
    }

    private double failures(String operation, String kind) {
        return registry.counter("ledger.operations.failed", "operation", operation, "kind", kind).count();
    }

    @Test
    @DisplayName("Running balances from the earliest java.time date is a typed INVALID_DATE")
    void testRunningBalancesFromLocalDateMin() {
        OperationResult<List<DailyBalance>> result =
            ledger.runningBalances(LocalDate.parse("-999999999-01-01"), LocalDate.of(2025, 1, 1));

        assertTrue(result.isFailure());
        assertEquals(LedgerErrorKind.INVALID_DATE, result.getErrorKind());
        assertEquals(1.0, failures("running_balances", "invalid_date"));
        verifyNoInteractions(entryStore);
    }

    @Test
    @DisplayName("Date arithmetic overflow inside a collaborator is INVALID_DATE")
    void testDateTimeExceptionIsClassified() {
        when(recurrenceEngine.generateUntil(anyLong(), any(LocalDate.class)))
            .thenThrow(new DateTimeException("Invalid value for Year"));

        OperationResult<GenerationResult> result = ledger.generateUntil(1L, LocalDate.of(2025, 1, 1));

        assertEquals(LedgerErrorKind.INVALID_DATE, result.getErrorKind());
        assertTrue(result.getMessage().contains("Invalid value for Year"));
    }

    @Test
    @DisplayName("Entry dates PostgreSQL could hold but the ledger does not are INVALID_DATE, not STORAGE_FAILURE")
    void testFarFutureEntryDate() {
        OperationResult<Long> result = ledger.insert(LocalDate.parse("+5874898-01-01"), 100, "far");

        assertEquals(LedgerErrorKind.INVALID_DATE, result.getErrorKind());
        verifyNoInteractions(entryStore);
    }

    @Test
    @DisplayName("Store failures are STORAGE_FAILURE")
    void testStorageFailure() {
        when(entryStore.insertManual(any(LocalDate.class), anyLong(), anyString()))
            .thenThrow(new DataAccessResourceFailureException("connection refused"));

        OperationResult<Long> result = ledger.insert(LocalDate.of(2025, 1, 1), 100, "x");

        assertEquals(LedgerErrorKind.STORAGE_FAILURE, result.getErrorKind());
        assertEquals(1.0, failures("insert", "storage_failure"));
    }

    @Test
    @DisplayName("Blank unit is INVALID_UNIT before the rule store is touched")
    void testBlankUnit() {
        OperationResult<Long> result = ledger.createRule(LocalDate.of(2025, 1, 1), 100, "x", 1, "  ");

        assertEquals(LedgerErrorKind.INVALID_UNIT, result.getErrorKind());
        verifyNoInteractions(ruleStore);
    }
}
