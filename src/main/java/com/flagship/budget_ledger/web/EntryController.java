package com.flagship.budget_ledger.web;

import com.flagship.budget_ledger.api.BudgetLedger;
import com.flagship.budget_ledger.entry.Entry;
import com.flagship.budget_ledger.error.LedgerException;
import com.flagship.budget_ledger.error.OperationResult;
import com.flagship.budget_ledger.web.dto.CreateEntryRequest;
import com.flagship.budget_ledger.web.dto.EntryIdResponse;
import com.flagship.budget_ledger.web.dto.EntryResponse;
import com.flagship.budget_ledger.web.dto.UpdateEntryRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.LocalDate;
import java.util.List;

/**
 * REST controller for individual ledger entries.
 *
 * Recording an entry is idempotent: posting the same date, amount, note and
 * rule twice returns the id of the first entry instead of creating another.
 */
@RestController
@RequestMapping("/api/entries")
@RequiredArgsConstructor
@Slf4j
public class EntryController {

    private final BudgetLedger ledger;

    @PostMapping
    public ResponseEntity<EntryIdResponse> createEntry(@Valid @RequestBody CreateEntryRequest request) {
        LocalDate date = IsoDates.parseDate(request.getDate(), "date");

        log.info("Recording entry: date={}, amount={}, ruleId={}",
                date, request.getAmountMinorUnits(), request.getRuleId());

        OperationResult<Long> result = request.getRuleId() == null
            ? ledger.insert(date, request.getAmountMinorUnits(), request.getNote())
            : ledger.insert(date, request.getAmountMinorUnits(), request.getNote(), request.getRuleId());

        return ResponseEntity.ok(new EntryIdResponse(result.getOrThrow()));
    }

    @GetMapping("/{id}")
    public ResponseEntity<EntryResponse> getEntry(@PathVariable("id") long id) {
        Entry entry = ledger.get(id).orElseThrow(() -> LedgerException.entryNotFound(id));
        return ResponseEntity.ok(EntryResponse.from(entry));
    }

    @GetMapping
    public ResponseEntity<List<EntryResponse>> listByDate(@RequestParam("date") String date) {
        List<EntryResponse> entries = ledger.listByDate(IsoDates.parseDate(date, "date"))
            .stream()
            .map(EntryResponse::from)
            .toList();
        return ResponseEntity.ok(entries);
    }

    @PutMapping("/{id}")
    public ResponseEntity<EntryResponse> updateEntry(@PathVariable("id") long id,
                                                     @Valid @RequestBody UpdateEntryRequest request) {
        LocalDate date = IsoDates.parseDate(request.getDate(), "date");
        Entry updated = ledger.update(id, date, request.getAmountMinorUnits(), request.getNote()).getOrThrow();
        return ResponseEntity.ok(EntryResponse.from(updated));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Void> deleteEntry(@PathVariable("id") long id) {
        boolean removed = ledger.delete(id).getOrThrow();
        if (!removed) {
            log.debug("Entry {} was already gone", id);
        }
        return ResponseEntity.noContent().build();
    }
}
