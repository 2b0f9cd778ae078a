package com.flagship.budget_ledger.web.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Value;

/**
 * Request DTO for editing an entry. The rule reference cannot be changed.
 */
@Value
public class UpdateEntryRequest {

    @NotBlank(message = "Date is required")
    @JsonProperty("date")
    String date;

    @NotNull(message = "Amount is required")
    @JsonProperty("amount_minor_units")
    Long amountMinorUnits;

    @JsonProperty("note")
    String note;
}
