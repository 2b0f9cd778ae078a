package com.flagship.budget_ledger.web.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.budget_ledger.recurrence.RecurrenceRule;
import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;

/**
 * Response DTO for a recurrence rule.
 */
@Value
@Builder
public class RuleResponse {

    @JsonProperty("id")
    long id;

    @JsonProperty("start_date")
    LocalDate startDate;

    @JsonProperty("amount_minor_units")
    long amountMinorUnits;

    @JsonProperty("note")
    String note;

    @JsonProperty("every_n")
    int everyN;

    @JsonProperty("unit")
    String unit;

    @JsonProperty("last_generated_date")
    LocalDate lastGeneratedDate;

    public static RuleResponse from(RecurrenceRule rule) {
        return RuleResponse.builder()
            .id(rule.getId())
            .startDate(rule.getStartDate())
            .amountMinorUnits(rule.getAmountMinorUnits())
            .note(rule.getNote())
            .everyN(rule.getEveryN())
            .unit(rule.getUnit().getCode())
            .lastGeneratedDate(rule.getLastGeneratedDate().orElse(null))
            .build();
    }
}
