package com.flagship.budget_ledger.web.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.budget_ledger.entry.Entry;
import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;

/**
 * Response DTO for a ledger entry.
 */
@Value
@Builder
public class EntryResponse {

    @JsonProperty("id")
    long id;

    @JsonProperty("date")
    LocalDate date;

    @JsonProperty("amount_minor_units")
    long amountMinorUnits;

    @JsonProperty("note")
    String note;

    @JsonProperty("rule_id")
    Long ruleId;

    // Lets a calendar mark occurrences of a series
    @JsonProperty("recurring")
    boolean recurring;

    public static EntryResponse from(Entry entry) {
        return EntryResponse.builder()
            .id(entry.getId())
            .date(entry.getDate())
            .amountMinorUnits(entry.getAmountMinorUnits())
            .note(entry.getNote())
            .ruleId(entry.getRuleId().orElse(null))
            .recurring(entry.isGenerated())
            .build();
    }
}
