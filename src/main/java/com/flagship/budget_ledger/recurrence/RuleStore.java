package com.flagship.budget_ledger.recurrence;

import com.flagship.budget_ledger.entry.EntryStore;
import com.flagship.budget_ledger.entry.StoreDates;
import com.flagship.budget_ledger.error.LedgerException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDate;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Persistence operations for recurrence rules.
 *
 * Bridges the domain model (RecurrenceRule) and the persistence model
 * (RecurrenceRuleEntity). Rules are created once, mutated only on their
 * cursor, and deleted together with the entries they generated.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class RuleStore {

    private final RecurrenceRuleRepository ruleRepository;
    private final EntryStore entryStore;

    /**
     * Creates a rule with no cursor.
     *
     * @throws LedgerException INVALID_DATE or NON_POSITIVE_INTERVAL before anything is written
     */
    @Transactional
    public RecurrenceRule create(LocalDate startDate, long amountMinorUnits, String note,
                                 int everyN, RecurrenceUnit unit) {
        StoreDates.requireStorable(startDate, "Rule start date");
        if (everyN < 1) {
            throw LedgerException.nonPositiveInterval(everyN);
        }
        Objects.requireNonNull(unit, "unit");
        Objects.requireNonNull(note, "note");

        RecurrenceRuleEntity saved = ruleRepository.save(
            RecurrenceRuleEntity.newRule(startDate, amountMinorUnits, note, everyN, unit));
        log.info("Created rule {}: start={}, every {} {}", saved.getId(), startDate, everyN, unit.getCode());
        return saved.toDomain();
    }

    @Transactional(readOnly = true)
    public Optional<RecurrenceRule> findById(long ruleId) {
        return ruleRepository.findById(ruleId)
            .map(RecurrenceRuleEntity::toDomain);
    }

    @Transactional(readOnly = true)
    public boolean exists(long ruleId) {
        return ruleRepository.existsById(ruleId);
    }

    /**
     * All rules in id (creation) order.
     */
    @Transactional(readOnly = true)
    public List<RecurrenceRule> findAll() {
        return ruleRepository.findAllByOrderByIdAsc().stream()
            .map(RecurrenceRuleEntity::toDomain)
            .toList();
    }

    /**
     * Records the date of the last materialized occurrence. Ignored when it
     * would move the cursor backwards.
     */
    @Transactional
    public boolean advanceCursor(long ruleId, LocalDate lastGenerated) {
        boolean moved = ruleRepository.advanceCursor(ruleId, lastGenerated) > 0;
        if (!moved) {
            log.debug("Cursor of rule {} not moved to {}", ruleId, lastGenerated);
        }
        return moved;
    }

    /**
     * Deletes a rule and every entry it generated, as one unit.
     *
     * @return number of entries removed; 0 when the rule was already gone
     */
    @Transactional
    public int deleteRuleAndEntries(long ruleId) {
        int entriesRemoved = entryStore.deleteByRule(ruleId);
        int rulesRemoved = ruleRepository.deleteRuleById(ruleId);

        if (rulesRemoved == 0) {
            log.info("Rule {} not found; nothing to delete", ruleId);
        } else {
            log.info("Deleted rule {} and {} generated entries", ruleId, entriesRemoved);
        }
        return entriesRemoved;
    }
}
