package com.flagship.budget_ledger.web.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.budget_ledger.balance.DailyBalance;
import lombok.Value;

import java.time.LocalDate;

@Value
public class DailyBalanceResponse {

    @JsonProperty("date")
    LocalDate date;

    @JsonProperty("day_total_minor_units")
    long dayTotalMinorUnits;

    @JsonProperty("ending_balance_minor_units")
    long endingBalanceMinorUnits;

    public static DailyBalanceResponse from(DailyBalance balance) {
        return new DailyBalanceResponse(
            balance.getDate(),
            balance.getDayTotalMinorUnits(),
            balance.getEndingBalanceMinorUnits()
        );
    }
}
