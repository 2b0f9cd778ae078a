package com.flagship.budget_ledger.recurrence;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;
import java.util.List;

/**
 * Repository for recurrence rules.
 */
@Repository
public interface RecurrenceRuleRepository extends JpaRepository<RecurrenceRuleEntity, Long> {

    List<RecurrenceRuleEntity> findAllByOrderByIdAsc();

    /**
     * Moves the expansion cursor forward. A cursor is never moved backwards:
     * the update matches only when the new date is later than the stored one.
     *
     * @return 1 if the cursor moved, 0 otherwise
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("""
        UPDATE RecurrenceRuleEntity r
        SET r.lastGeneratedDate = :cursor
        WHERE r.id = :id
        AND (r.lastGeneratedDate IS NULL OR r.lastGeneratedDate < :cursor)
        """)
    int advanceCursor(@Param("id") Long id, @Param("cursor") LocalDate cursor);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("DELETE FROM RecurrenceRuleEntity r WHERE r.id = :id")
    int deleteRuleById(@Param("id") Long id);
}
