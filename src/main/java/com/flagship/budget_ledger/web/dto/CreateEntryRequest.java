package com.flagship.budget_ledger.web.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Value;

/**
 * Request DTO for recording an entry. Amounts are integer minor units.
 * A missing rule_id records a manual entry.
 */
@Value
public class CreateEntryRequest {

    @NotBlank(message = "Date is required")
    @JsonProperty("date")
    String date;

    @NotNull(message = "Amount is required")
    @JsonProperty("amount_minor_units")
    Long amountMinorUnits;

    @JsonProperty("note")
    String note;

    @JsonProperty("rule_id")
    Long ruleId;
}
