package com.flagship.budget_ledger;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class BudgetLedgerApplication {

    public static void main(String[] args) {
        SpringApplication.run(BudgetLedgerApplication.class, args);
    }
}
