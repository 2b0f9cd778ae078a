package com.flagship.budget_ledger.web.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

import java.time.LocalDate;

/**
 * Balance through the end of a day.
 */
@Value
public class BalanceResponse {

    @JsonProperty("date")
    LocalDate date;

    @JsonProperty("balance_minor_units")
    long balanceMinorUnits;
}
