package com.flagship.budget_ledger.balance;

import lombok.Value;

import java.time.LocalDate;

/**
 * One day of a running balance: the day's net movement and the balance at the end of the day.
 */
@Value
public class DailyBalance {
    LocalDate date;
    long dayTotalMinorUnits;
    long endingBalanceMinorUnits;
}
