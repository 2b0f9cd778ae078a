package com.flagship.budget_ledger.recurrence;

import com.flagship.budget_ledger.entry.Entry;
import com.flagship.budget_ledger.entry.EntryStore;
import com.flagship.budget_ledger.error.LedgerErrorKind;
import com.flagship.budget_ledger.error.LedgerException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.time.LocalDate;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Recurrence expansion tests.
 *
 * These tests verify that:
 * - A monthly rule materializes exactly its occurrences up to the horizon
 * - The cursor records the last materialized occurrence
 * - Expanding with a growing horizon equals one expansion to the largest horizon
 * - Missing rules and horizons before the start are no-ops
 */
@SpringBootTest
@Testcontainers
class RecurrenceEngineTest {

    @Container
    static PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>("postgres:15-alpine")
            .withDatabaseName("test_budget_ledger")
            .withUsername("test")
            .withPassword("test");

    @DynamicPropertySource
    static void configureProperties(DynamicPropertyRegistry registry) {
        registry.add("spring.datasource.url", postgres::getJdbcUrl);
        registry.add("spring.datasource.username", postgres::getUsername);
        registry.add("spring.datasource.password", postgres::getPassword);
    }

    @Autowired
    private RecurrenceEngine recurrenceEngine;

    @Autowired
    private RuleStore ruleStore;

    @Autowired
    private EntryStore entryStore;

    @Autowired
    private JdbcTemplate jdbcTemplate;

    @BeforeEach
    void setUp() {
        jdbcTemplate.update("DELETE FROM entries");
        jdbcTemplate.update("DELETE FROM recurrence_rules");
    }

    // Helper methods for test output
    private void printTestHeader(String testName) {
        System.out.println("\n" + "=".repeat(80));
        System.out.println("TEST: " + testName);
        System.out.println("=".repeat(80));
    }

    private void printInput(String label, Object value) {
        System.out.println("INPUT  - " + label + ": " + value);
    }

    private void printOutput(String label, Object value) {
        System.out.println("OUTPUT - " + label + ": " + value);
    }

    private void printSuccess(String message) {
        System.out.println("✓ SUCCESS: " + message);
    }

    private RecurrenceRule monthlyRent() {
        return ruleStore.create(LocalDate.of(2025, 1, 1), -5000, "rent", 1, RecurrenceUnit.MONTH);
    }

    @Test
    @DisplayName("Monthly rule expanded to 2025-04-01 should produce four entries and move the cursor")
    void testMonthlyScenario() {
        printTestHeader("Monthly Expansion Scenario");
        RecurrenceRule rule = monthlyRent();
        printInput("Rule", rule);
        printInput("Horizon", "2025-04-01");

        GenerationResult result = recurrenceEngine.generateUntil(rule.getId(), LocalDate.of(2025, 4, 1));
        printOutput("Result", result);

        List<Entry> entries = entryStore.listByRule(rule.getId());
        printOutput("Entries", entries);

        assertEquals(4, result.getOccurrencesProduced());
        assertEquals(List.of(
                LocalDate.of(2025, 1, 1),
                LocalDate.of(2025, 2, 1),
                LocalDate.of(2025, 3, 1),
                LocalDate.of(2025, 4, 1)),
            entries.stream().map(Entry::getDate).toList());
        assertTrue(entries.stream().allMatch(e -> e.getAmountMinorUnits() == -5000));
        assertTrue(entries.stream().allMatch(e -> e.getRuleId().orElseThrow() == rule.getId()));
        assertEquals(LocalDate.of(2025, 4, 1),
            ruleStore.findById(rule.getId()).orElseThrow().getLastGeneratedDate().orElseThrow());
        printSuccess("Occurrences and cursor match");
    }

    @Test
    @DisplayName("Growing horizons should give the same entries as one expansion to the largest")
    void testGrowingHorizonIsIdempotent() {
        printTestHeader("Idempotent Generation");
        RecurrenceRule stepwise = ruleStore.create(LocalDate.of(2025, 1, 31), -300, "gym", 1, RecurrenceUnit.MONTH);
        RecurrenceRule direct = ruleStore.create(LocalDate.of(2025, 1, 31), -300, "gym direct", 1, RecurrenceUnit.MONTH);

        recurrenceEngine.generateUntil(stepwise.getId(), LocalDate.of(2025, 2, 15));
        recurrenceEngine.generateUntil(stepwise.getId(), LocalDate.of(2025, 4, 30));
        GenerationResult repeat = recurrenceEngine.generateUntil(stepwise.getId(), LocalDate.of(2025, 4, 30));
        recurrenceEngine.generateUntil(stepwise.getId(), LocalDate.of(2025, 6, 30));
        recurrenceEngine.generateUntil(direct.getId(), LocalDate.of(2025, 6, 30));

        List<LocalDate> stepwiseDates = entryStore.listByRule(stepwise.getId()).stream().map(Entry::getDate).toList();
        List<LocalDate> directDates = entryStore.listByRule(direct.getId()).stream().map(Entry::getDate).toList();
        printOutput("Stepwise", stepwiseDates);
        printOutput("Direct", directDates);

        assertEquals(0, repeat.getOccurrencesProduced(), "Repeating a horizon should produce nothing");
        assertEquals(directDates, stepwiseDates);
        // Clamping carries forward from the cursor
        assertEquals(LocalDate.of(2025, 2, 28), stepwiseDates.get(1));
        assertEquals(LocalDate.of(2025, 3, 28), stepwiseDates.get(2));
        printSuccess("Stepwise expansion equals direct expansion");
    }

    @Test
    @DisplayName("Weekly rule with an interval of two weeks")
    void testBiweeklyRule() {
        printTestHeader("Biweekly Expansion");
        RecurrenceRule rule = ruleStore.create(LocalDate.of(2025, 3, 3), 2000, "allowance", 2, RecurrenceUnit.WEEK);

        GenerationResult result = recurrenceEngine.generateUntil(rule.getId(), LocalDate.of(2025, 3, 31));
        printOutput("Result", result);

        assertEquals(3, result.getOccurrencesProduced());
        assertEquals(LocalDate.of(2025, 3, 31), result.getCursor().orElseThrow());
        printSuccess("Mar 3, Mar 17, Mar 31");
    }

    @Test
    @DisplayName("Generating for a missing rule is a no-op")
    void testMissingRule() {
        printTestHeader("Missing Rule");

        GenerationResult result = recurrenceEngine.generateUntil(424_242L, LocalDate.of(2030, 1, 1));
        printOutput("Result", result);

        assertFalse(result.isRuleFound());
        assertEquals(0, result.getOccurrencesProduced());
        printSuccess("Nothing generated");
    }

    @Test
    @DisplayName("Horizon before the start date produces nothing and leaves the cursor unset")
    void testHorizonBeforeStart() {
        printTestHeader("Horizon Before Start");
        RecurrenceRule rule = monthlyRent();

        GenerationResult result = recurrenceEngine.generateUntil(rule.getId(), LocalDate.of(2024, 12, 31));

        assertTrue(result.isRuleFound());
        assertEquals(0, result.getOccurrencesProduced());
        assertTrue(result.getCursor().isEmpty());
        assertTrue(ruleStore.findById(rule.getId()).orElseThrow().getLastGeneratedDate().isEmpty());
        assertEquals(0, entryStore.countByRule(rule.getId()));
        printSuccess("No entries, no cursor");
    }

    @Test
    @DisplayName("A deleted occurrence is not regenerated once the cursor has passed it")
    void testDeletedOccurrenceStaysDeleted() {
        printTestHeader("Deleted Occurrence");
        RecurrenceRule rule = monthlyRent();
        recurrenceEngine.generateUntil(rule.getId(), LocalDate.of(2025, 4, 1));

        Entry february = entryStore.listByRule(rule.getId()).get(1);
        entryStore.delete(february.getId());
        recurrenceEngine.generateUntil(rule.getId(), LocalDate.of(2025, 4, 1));

        assertEquals(3, entryStore.countByRule(rule.getId()));
        printSuccess("Cursor did not regress");
    }

    @Test
    @DisplayName("A missing horizon is an INVALID_DATE error")
    void testNullHorizon() {
        RecurrenceRule rule = monthlyRent();

        LedgerException e = assertThrows(LedgerException.class,
            () -> recurrenceEngine.generateUntil(rule.getId(), null));

        assertEquals(LedgerErrorKind.INVALID_DATE, e.getKind());
    }

    @Test
    @DisplayName("A horizon beyond year 9999 is INVALID_DATE and generates nothing")
    void testHorizonOutOfRange() {
        RecurrenceRule rule = monthlyRent();

        LedgerException e = assertThrows(LedgerException.class,
            () -> recurrenceEngine.generateUntil(rule.getId(), LocalDate.of(10_000, 1, 1)));

        assertEquals(LedgerErrorKind.INVALID_DATE, e.getKind());
        assertEquals(0, entryStore.countByRule(rule.getId()));
    }
}
