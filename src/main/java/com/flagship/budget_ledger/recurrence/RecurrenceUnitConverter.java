package com.flagship.budget_ledger.recurrence;

import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

/**
 * Stores {@link RecurrenceUnit} as its lowercase code ("day", "week", "month"),
 * matching the CHECK constraint on recurrence_rules.unit.
 */
@Converter
public class RecurrenceUnitConverter implements AttributeConverter<RecurrenceUnit, String> {

    @Override
    public String convertToDatabaseColumn(RecurrenceUnit unit) {
        return unit == null ? null : unit.getCode();
    }

    @Override
    public RecurrenceUnit convertToEntityAttribute(String code) {
        return code == null ? null : RecurrenceUnit.fromCode(code);
    }
}
