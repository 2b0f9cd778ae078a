package com.flagship.budget_ledger.entry;

import com.flagship.budget_ledger.error.LedgerException;
import com.flagship.budget_ledger.observability.LedgerMetrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.SqlParameterValue;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.sql.Types;
import java.time.LocalDate;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Durable store of ledger entries.
 *
 * This is the only write path for entries: manual inserts and recurrence
 * expansion both go through {@link #insertManual} / {@link #insertForRule},
 * so duplicate suppression lives in one place.
 *
 * Invariants enforced by the database:
 * 1. At most one row per (date, amount, note, rule_id), with "no rule" as a
 *    single identity value (constraint ux_entries_identity)
 * 2. Entries of a deleted rule are removed with it (ON DELETE CASCADE)
 * 3. daily_totals always equals the per-day sum of entries (trigger)
 */
@Service
@Slf4j
public class EntryStore {

    private static final String IDENTITY_CONSTRAINT = "ux_entries_identity";

    private static final String ENTRY_COLUMNS = "id, entry_date, amount_minor_units, note, rule_id";

    private final JdbcTemplate jdbcTemplate;
    private final LedgerMetrics metrics;

    public EntryStore(JdbcTemplate jdbcTemplate, LedgerMetrics metrics) {
        this.jdbcTemplate = jdbcTemplate;
        this.metrics = metrics;
    }

    /**
     * Inserts a manual entry, or returns the id of the identical manual entry
     * that already exists.
     */
    @Transactional
    public long insertManual(LocalDate date, long amountMinorUnits, String note) {
        return insert(date, amountMinorUnits, note, null);
    }

    /**
     * Inserts an entry generated by a rule, or returns the id of the identical
     * entry that already exists for that rule.
     */
    @Transactional
    public long insertForRule(LocalDate date, long amountMinorUnits, String note, long ruleId) {
        return insert(date, amountMinorUnits, note, ruleId);
    }

    private long insert(LocalDate date, long amountMinorUnits, String note, Long ruleId) {
        Objects.requireNonNull(date, "date");
        Objects.requireNonNull(note, "note");

        // Single statement: a conflicting row makes the insert a no-op instead of an error
        List<Long> inserted = jdbcTemplate.query(
            "INSERT INTO entries (entry_date, amount_minor_units, note, rule_id) VALUES (?, ?, ?, ?) " +
            "ON CONFLICT ON CONSTRAINT " + IDENTITY_CONSTRAINT + " DO NOTHING " +
            "RETURNING id",
            (rs, rowNum) -> rs.getLong("id"),
            date,
            amountMinorUnits,
            note,
            ruleIdParameter(ruleId)
        );

        if (!inserted.isEmpty()) {
            metrics.recordInsert(true);
            log.debug("Inserted entry {} on {} (rule={})", inserted.get(0), date, ruleId);
            return inserted.get(0);
        }

        Long existingId = jdbcTemplate.queryForObject(
            "SELECT id FROM entries " +
            "WHERE entry_date = ? AND amount_minor_units = ? AND note = ? AND rule_id IS NOT DISTINCT FROM ?",
            Long.class,
            date,
            amountMinorUnits,
            note,
            ruleIdParameter(ruleId)
        );
        metrics.recordInsert(false);
        log.debug("Entry on {} (rule={}) already exists as {}", date, ruleId, existingId);
        return existingId;
    }

    /**
     * Overwrites date, amount and note of an existing entry. The rule
     * reference is never changed here.
     *
     * @return the entry as stored after the update
     * @throws LedgerException NOT_FOUND if no entry has this id
     * @throws org.springframework.dao.DuplicateKeyException if the new values
     *         collide with another entry's identity
     */
    @Transactional
    public Entry update(long entryId, LocalDate date, long amountMinorUnits, String note) {
        Objects.requireNonNull(date, "date");
        Objects.requireNonNull(note, "note");

        int updated = jdbcTemplate.update(
            "UPDATE entries SET entry_date = ?, amount_minor_units = ?, note = ? WHERE id = ?",
            date,
            amountMinorUnits,
            note,
            entryId
        );
        if (updated == 0) {
            throw LedgerException.entryNotFound(entryId);
        }
        log.debug("Updated entry {}", entryId);
        return get(entryId).orElseThrow(() -> LedgerException.entryNotFound(entryId));
    }

    /**
     * Deletes a single entry.
     *
     * @return true if a row was removed, false if it was already gone
     */
    @Transactional
    public boolean delete(long entryId) {
        int deleted = jdbcTemplate.update("DELETE FROM entries WHERE id = ?", entryId);
        log.debug("Delete entry {}: {} row(s)", entryId, deleted);
        return deleted > 0;
    }

    /**
     * Deletes every entry generated by a rule.
     *
     * @return number of entries removed
     */
    @Transactional
    public int deleteByRule(long ruleId) {
        return jdbcTemplate.update("DELETE FROM entries WHERE rule_id = ?", ruleId);
    }

    /**
     * Attaches a manual entry to a rule, keeping the entry's id.
     * Reconciliation is the only caller; {@link #update} never changes the rule reference.
     *
     * @return true if a manual entry with this id was re-parented
     */
    @Transactional
    public boolean attachToRule(long entryId, long ruleId) {
        int updated = jdbcTemplate.update(
            "UPDATE entries SET rule_id = ? WHERE id = ? AND rule_id IS NULL",
            ruleId,
            entryId
        );
        return updated > 0;
    }

    /**
     * All entries on a day, most recently inserted first.
     */
    @Transactional(readOnly = true)
    public List<Entry> listByDate(LocalDate date) {
        return jdbcTemplate.query(
            "SELECT " + ENTRY_COLUMNS + " FROM entries WHERE entry_date = ? ORDER BY id DESC",
            entryRowMapper(),
            date
        );
    }

    /**
     * All entries generated by a rule, in date order.
     */
    @Transactional(readOnly = true)
    public List<Entry> listByRule(long ruleId) {
        return jdbcTemplate.query(
            "SELECT " + ENTRY_COLUMNS + " FROM entries WHERE rule_id = ? ORDER BY entry_date, id",
            entryRowMapper(),
            ruleId
        );
    }

    @Transactional(readOnly = true)
    public int countByRule(long ruleId) {
        Integer count = jdbcTemplate.queryForObject(
            "SELECT COUNT(*) FROM entries WHERE rule_id = ?",
            Integer.class,
            ruleId
        );
        return count != null ? count : 0;
    }

    @Transactional(readOnly = true)
    public Optional<Entry> get(long entryId) {
        List<Entry> rows = jdbcTemplate.query(
            "SELECT " + ENTRY_COLUMNS + " FROM entries WHERE id = ?",
            entryRowMapper(),
            entryId
        );
        return rows.stream().findFirst();
    }

    @Transactional(readOnly = true)
    public Optional<Entry> findManualMatch(LocalDate date, long amountMinorUnits, String note) {
        return jdbcTemplate.query(
            "SELECT " + ENTRY_COLUMNS + " FROM entries " +
            "WHERE entry_date = ? AND amount_minor_units = ? AND note = ? AND rule_id IS NULL " +
            "ORDER BY id LIMIT 1",
            entryRowMapper(),
            date,
            amountMinorUnits,
            note
        ).stream().findFirst();
    }

    @Transactional(readOnly = true)
    public Optional<Entry> findGeneratedMatch(LocalDate date, long amountMinorUnits, String note, long ruleId) {
        return jdbcTemplate.query(
            "SELECT " + ENTRY_COLUMNS + " FROM entries " +
            "WHERE entry_date = ? AND amount_minor_units = ? AND note = ? AND rule_id = ? " +
            "ORDER BY id LIMIT 1",
            entryRowMapper(),
            date,
            amountMinorUnits,
            note,
            ruleId
        ).stream().findFirst();
    }

    /**
     * Sum of all entry amounts dated on or before the given day.
     * Reads the per-day pre-aggregation, so cost grows with the number of
     * distinct days, not the number of entries.
     */
    @Transactional(readOnly = true)
    public long runningBalanceThrough(LocalDate date) {
        Long balance = jdbcTemplate.queryForObject(
            "SELECT COALESCE(SUM(total_minor_units), 0) FROM daily_totals WHERE day <= ?",
            Long.class,
            date
        );
        return balance != null ? balance : 0L;
    }

    /**
     * Per-day sums for days inside [from, to] that have at least one entry.
     */
    @Transactional(readOnly = true)
    public SortedMap<LocalDate, Long> dailyTotals(LocalDate from, LocalDate to) {
        SortedMap<LocalDate, Long> totals = new TreeMap<>();
        jdbcTemplate.query(
            "SELECT day, total_minor_units FROM daily_totals WHERE day BETWEEN ? AND ? ORDER BY day",
            rs -> {
                totals.put(rs.getObject("day", LocalDate.class), rs.getLong("total_minor_units"));
            },
            from,
            to
        );
        return totals;
    }

    private SqlParameterValue ruleIdParameter(Long ruleId) {
        return new SqlParameterValue(Types.BIGINT, ruleId);
    }

    private RowMapper<Entry> entryRowMapper() {
        return (rs, rowNum) -> new Entry(
            rs.getLong("id"),
            rs.getObject("entry_date", LocalDate.class),
            rs.getLong("amount_minor_units"),
            rs.getString("note"),
            rs.getObject("rule_id", Long.class)
        );
    }
}
