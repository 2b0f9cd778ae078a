package com.flagship.budget_ledger.web.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Value;

/**
 * Request DTO for creating a recurring series.
 *
 * unit is one of day, week or month; every_n must be at least 1. Both are
 * checked by the ledger so the error kind is reported precisely: a missing
 * or blank unit is INVALID_UNIT, not a bean-validation failure.
 * reference_month (yyyy-MM) is the month the caller is looking at; the
 * series is expanded through the configured number of months after it.
 */
@Value
public class CreateRuleRequest {

    @NotBlank(message = "Start date is required")
    @JsonProperty("start_date")
    String startDate;

    @NotNull(message = "Amount is required")
    @JsonProperty("amount_minor_units")
    Long amountMinorUnits;

    @JsonProperty("note")
    String note;

    @NotNull(message = "Interval is required")
    @JsonProperty("every_n")
    Integer everyN;

    @JsonProperty("unit")
    String unit;

    @JsonProperty("reference_month")
    String referenceMonth;
}
