package com.flagship.budget_ledger.balance;

import com.flagship.budget_ledger.entry.EntryStore;
import com.flagship.budget_ledger.entry.StoreDates;
import com.flagship.budget_ledger.error.LedgerException;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDate;
import java.time.YearMonth;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.SortedMap;

/**
 * Derives balances from the ledger. Balances are computed, never stored.
 *
 * A range is seeded with the balance through the day before it starts and
 * then accumulated forward using only the per-day sums inside the range, so
 * rendering N days costs one point query plus one range query.
 */
@Service
@RequiredArgsConstructor
public class BalanceCalculator {

    /**
     * Longest range rendered in one call: ten years of days.
     */
    public static final long MAX_RANGE_DAYS = 3660;

    private final EntryStore entryStore;

    @Transactional(readOnly = true)
    public long balanceThrough(LocalDate date) {
        StoreDates.requireStorable(date, "Balance date");
        return entryStore.runningBalanceThrough(date);
    }

    /**
     * Ending balance for every day in [from, to], including days without entries.
     *
     * @throws LedgerException INVALID_DATE if a bound is missing or out of range, from is
     *         after to, or the range spans more than {@link #MAX_RANGE_DAYS} days
     */
    @Transactional(readOnly = true)
    public List<DailyBalance> runningBalances(LocalDate from, LocalDate to) {
        StoreDates.requireStorable(from, "Range start");
        StoreDates.requireStorable(to, "Range end");
        if (from.isAfter(to)) {
            throw LedgerException.invalidDate(
                String.format("Range start %s is after range end %s", from, to));
        }
        if (ChronoUnit.DAYS.between(from, to) >= MAX_RANGE_DAYS) {
            throw LedgerException.invalidDate(
                String.format("Range %s..%s spans more than %d days", from, to, MAX_RANGE_DAYS));
        }

        long running = entryStore.runningBalanceThrough(from.minusDays(1));
        SortedMap<LocalDate, Long> dayTotals = entryStore.dailyTotals(from, to);

        List<DailyBalance> balances = new ArrayList<>();
        for (LocalDate day = from; !day.isAfter(to); day = day.plusDays(1)) {
            long dayTotal = dayTotals.getOrDefault(day, 0L);
            running += dayTotal;
            balances.add(new DailyBalance(day, dayTotal, running));
        }
        return balances;
    }

    @Transactional(readOnly = true)
    public List<DailyBalance> monthBalances(YearMonth month) {
        if (month == null) {
            throw LedgerException.invalidDate("Month is required");
        }
        return runningBalances(month.atDay(1), month.atEndOfMonth());
    }
}
