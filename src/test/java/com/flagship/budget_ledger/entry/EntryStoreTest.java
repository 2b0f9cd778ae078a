package com.flagship.budget_ledger.entry;

import com.flagship.budget_ledger.error.LedgerErrorKind;
import com.flagship.budget_ledger.error.LedgerException;
import com.flagship.budget_ledger.recurrence.RecurrenceRule;
import com.flagship.budget_ledger.recurrence.RecurrenceUnit;
import com.flagship.budget_ledger.recurrence.RuleStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.time.LocalDate;
import java.util.List;
import java.util.SortedMap;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Ledger store tests: try to break entry identity.
 *
 * These tests verify that:
 * - The same (date, amount, note, rule) tuple is stored once
 * - Manual entries deduplicate among themselves despite having no rule
 * - Updates report missing entries and identity collisions
 * - The daily totals maintained by the database follow every write
 */
@SpringBootTest
@Testcontainers
class EntryStoreTest {

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
    private EntryStore entryStore;

    @Autowired
    private RuleStore ruleStore;

    @Autowired
    private JdbcTemplate jdbcTemplate;

    private static final LocalDate DAY = LocalDate.of(2025, 3, 10);

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

    private int countEntries() {
        Integer count = jdbcTemplate.queryForObject("SELECT COUNT(*) FROM entries", Integer.class);
        return count != null ? count : 0;
    }

    @Test
    @DisplayName("Inserting the same manual entry twice should return the same id")
    void testManualInsertIsIdempotent() {
        printTestHeader("Manual Insert Idempotency");
        printInput("Entry", DAY + ", -1250, 'coffee'");

        long first = entryStore.insertManual(DAY, -1250, "coffee");
        long second = entryStore.insertManual(DAY, -1250, "coffee");
        printOutput("First id", first);
        printOutput("Second id", second);

        assertEquals(first, second, "Duplicate manual insert should resolve to the existing entry");
        assertEquals(1, countEntries(), "Exactly one row should exist");
        printSuccess("Manual entries without a rule deduplicate");
    }

    @Test
    @DisplayName("Same values with and without a rule are distinct entries")
    void testRuleIsPartOfIdentity() {
        printTestHeader("Rule Reference Is Part Of Identity");
        RecurrenceRule rule = ruleStore.create(DAY, -1250, "coffee", 1, RecurrenceUnit.DAY);

        long manual = entryStore.insertManual(DAY, -1250, "coffee");
        long generated = entryStore.insertForRule(DAY, -1250, "coffee", rule.getId());
        long generatedAgain = entryStore.insertForRule(DAY, -1250, "coffee", rule.getId());
        printOutput("Manual id", manual);
        printOutput("Generated id", generated);

        assertNotEquals(manual, generated);
        assertEquals(generated, generatedAgain);
        assertEquals(2, countEntries());
        printSuccess("Identity includes the rule reference");
    }

    @Test
    @DisplayName("Different notes on the same day are separate entries")
    void testDifferentNotesAreDistinct() {
        printTestHeader("Distinct Notes");

        long lunch = entryStore.insertManual(DAY, -1250, "lunch");
        long dinner = entryStore.insertManual(DAY, -1250, "dinner");

        assertNotEquals(lunch, dinner);
        assertEquals(2, countEntries());
        printSuccess("Note participates in identity");
    }

    @Test
    @DisplayName("Updating a missing entry should report NOT_FOUND")
    void testUpdateMissingEntry() {
        printTestHeader("Update Missing Entry");

        LedgerException e = assertThrows(LedgerException.class,
            () -> entryStore.update(999_999L, DAY, 100, "ghost"));
        printOutput("Kind", e.getKind());

        assertEquals(LedgerErrorKind.NOT_FOUND, e.getKind());
        assertEquals(0, countEntries());
        printSuccess("Missing entry reported, nothing written");
    }

    @Test
    @DisplayName("Update that collides with another entry is rejected by the identity constraint")
    void testUpdateCollision() {
        printTestHeader("Update Collision");
        long keep = entryStore.insertManual(DAY, -500, "bus");
        long other = entryStore.insertManual(DAY, -700, "taxi");

        assertThrows(DuplicateKeyException.class,
            () -> entryStore.update(other, DAY, -500, "bus"));

        assertEquals(-700, entryStore.get(other).orElseThrow().getAmountMinorUnits());
        assertEquals(-500, entryStore.get(keep).orElseThrow().getAmountMinorUnits());
        printSuccess("Collision rejected, both entries unchanged");
    }

    @Test
    @DisplayName("Update should overwrite values and keep the rule reference")
    void testUpdateKeepsRule() {
        printTestHeader("Update Keeps Rule");
        RecurrenceRule rule = ruleStore.create(DAY, 10_000, "salary", 1, RecurrenceUnit.MONTH);
        long id = entryStore.insertForRule(DAY, 10_000, "salary", rule.getId());

        Entry updated = entryStore.update(id, DAY.plusDays(1), 12_000, "salary + bonus");
        printOutput("Updated", updated);

        assertEquals(DAY.plusDays(1), updated.getDate());
        assertEquals(12_000, updated.getAmountMinorUnits());
        assertEquals("salary + bonus", updated.getNote());
        assertEquals(rule.getId(), updated.getRuleId().orElseThrow());
        printSuccess("Values overwritten, rule reference kept");
    }

    @Test
    @DisplayName("Entries on a day are listed most recent first")
    void testListByDateOrder() {
        printTestHeader("List By Date Order");
        long first = entryStore.insertManual(DAY, -100, "a");
        long second = entryStore.insertManual(DAY, -200, "b");
        entryStore.insertManual(DAY.plusDays(1), -300, "other day");

        List<Entry> entries = entryStore.listByDate(DAY);
        printOutput("Entries", entries);

        assertEquals(2, entries.size());
        assertEquals(second, entries.get(0).getId());
        assertEquals(first, entries.get(1).getId());
        printSuccess("Newest entry first, other days excluded");
    }

    @Test
    @DisplayName("Deleting an entry twice should succeed both times")
    void testDeleteIsIdempotent() {
        printTestHeader("Delete Idempotency");
        long id = entryStore.insertManual(DAY, -100, "gum");

        assertTrue(entryStore.delete(id));
        assertFalse(entryStore.delete(id));
        assertTrue(entryStore.get(id).isEmpty());
        printSuccess("Second delete is a no-op");
    }

    @Test
    @DisplayName("Running balance and daily totals should follow inserts, updates and deletes")
    void testDailyTotalsFollowWrites() {
        printTestHeader("Daily Totals Maintenance");
        entryStore.insertManual(DAY.minusDays(2), 50_000, "salary");
        long rent = entryStore.insertManual(DAY, -20_000, "rent");
        entryStore.insertManual(DAY, -1_000, "snack");

        assertEquals(50_000, entryStore.runningBalanceThrough(DAY.minusDays(1)));
        assertEquals(29_000, entryStore.runningBalanceThrough(DAY));

        entryStore.update(rent, DAY.plusDays(5), -20_000, "rent");
        assertEquals(49_000, entryStore.runningBalanceThrough(DAY));
        assertEquals(29_000, entryStore.runningBalanceThrough(DAY.plusDays(5)));

        SortedMap<LocalDate, Long> totals = entryStore.dailyTotals(DAY.minusDays(2), DAY.plusDays(5));
        printOutput("Daily totals", totals);
        assertEquals(3, totals.size());
        assertEquals(-1_000L, totals.get(DAY));

        entryStore.delete(rent);
        assertEquals(49_000, entryStore.runningBalanceThrough(DAY.plusDays(5)));
        assertFalse(entryStore.dailyTotals(DAY.plusDays(5), DAY.plusDays(5)).containsKey(DAY.plusDays(5)),
            "A day whose last entry is deleted should disappear from the totals");
        printSuccess("Daily totals consistent with entries");
    }

    @Test
    @DisplayName("Balance before any entry is zero")
    void testEmptyLedgerBalance() {
        assertEquals(0, entryStore.runningBalanceThrough(DAY));
    }
}
