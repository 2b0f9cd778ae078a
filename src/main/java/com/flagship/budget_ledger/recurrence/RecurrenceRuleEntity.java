package com.flagship.budget_ledger.recurrence;

import jakarta.persistence.Column;
import jakarta.persistence.Convert;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.LocalDate;

/**
 * JPA Entity for recurrence rule persistence.
 *
 * Key design principles:
 * - No @Setter: template fields are immutable once created
 * - The cursor (last_generated_date) only moves through
 *   {@link RecurrenceRuleRepository#advanceCursor}
 * - Controlled factory: {@link #newRule} is the only way to create entities
 */
@Entity
@Table(name = "recurrence_rules")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class RecurrenceRuleEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(nullable = false, updatable = false)
    private Long id;

    @Column(name = "start_date", nullable = false, updatable = false)
    private LocalDate startDate;

    @Column(name = "amount_minor_units", nullable = false, updatable = false)
    private long amountMinorUnits;

    @Column(nullable = false, updatable = false)
    private String note;

    @Column(name = "every_n", nullable = false, updatable = false)
    private int everyN;

    @Convert(converter = RecurrenceUnitConverter.class)
    @Column(nullable = false, updatable = false, length = 5)
    private RecurrenceUnit unit;

    @Column(name = "last_generated_date")
    private LocalDate lastGeneratedDate;

    static RecurrenceRuleEntity newRule(LocalDate startDate, long amountMinorUnits, String note,
                                        int everyN, RecurrenceUnit unit) {
        return new RecurrenceRuleEntity(
            null, // id - assigned by the database
            startDate,
            amountMinorUnits,
            note,
            everyN,
            unit,
            null  // lastGeneratedDate - nothing generated yet
        );
    }

    public RecurrenceRule toDomain() {
        return new RecurrenceRule(
            id,
            startDate,
            amountMinorUnits,
            note,
            everyN,
            unit,
            lastGeneratedDate
        );
    }
}
