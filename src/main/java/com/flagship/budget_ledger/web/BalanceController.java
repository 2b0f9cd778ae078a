package com.flagship.budget_ledger.web;

import com.flagship.budget_ledger.api.BudgetLedger;
import com.flagship.budget_ledger.web.dto.BalanceResponse;
import com.flagship.budget_ledger.web.dto.DailyBalanceResponse;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.LocalDate;
import java.util.List;

@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class BalanceController {

    private final BudgetLedger ledger;

    @GetMapping("/balances/{date}")
    public ResponseEntity<BalanceResponse> balanceThrough(@PathVariable("date") String date) {
        LocalDate through = IsoDates.parseDate(date, "date");
        return ResponseEntity.ok(new BalanceResponse(through, ledger.runningBalanceThrough(through)));
    }

    @GetMapping("/balances")
    public ResponseEntity<List<DailyBalanceResponse>> runningBalances(@RequestParam("from") String from,
                                                                      @RequestParam("to") String to) {
        List<DailyBalanceResponse> balances = ledger.runningBalances(
                IsoDates.parseDate(from, "from"),
                IsoDates.parseDate(to, "to"))
            .getOrThrow()
            .stream()
            .map(DailyBalanceResponse::from)
            .toList();
        return ResponseEntity.ok(balances);
    }

    /**
     * Month view: every rule is expanded through the month's far horizon first.
     */
    @GetMapping("/months/{month}/balances")
    public ResponseEntity<List<DailyBalanceResponse>> monthBalances(@PathVariable("month") String month) {
        List<DailyBalanceResponse> balances = ledger.monthBalances(IsoDates.parseMonth(month, "month"))
            .getOrThrow()
            .stream()
            .map(DailyBalanceResponse::from)
            .toList();
        return ResponseEntity.ok(balances);
    }
}
