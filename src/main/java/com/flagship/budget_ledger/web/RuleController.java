package com.flagship.budget_ledger.web;

import com.flagship.budget_ledger.api.BudgetLedger;
import com.flagship.budget_ledger.api.SeriesCreation;
import com.flagship.budget_ledger.error.LedgerException;
import com.flagship.budget_ledger.recurrence.GenerationResult;
import com.flagship.budget_ledger.reconciliation.ReconciliationOutcome;
import com.flagship.budget_ledger.web.dto.CreateRuleRequest;
import com.flagship.budget_ledger.web.dto.EntryResponse;
import com.flagship.budget_ledger.web.dto.GenerationResponse;
import com.flagship.budget_ledger.web.dto.ReconciliationResponse;
import com.flagship.budget_ledger.web.dto.RuleDeletionResponse;
import com.flagship.budget_ledger.web.dto.RuleResponse;
import com.flagship.budget_ledger.web.dto.SeriesResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.LocalDate;
import java.time.YearMonth;
import java.util.List;

/**
 * REST controller for recurrence rules.
 *
 * Creating a rule runs the whole series flow: the rule is stored, a manual
 * entry on its start date is adopted, and occurrences are generated through
 * the far horizon of the reference month.
 */
@RestController
@RequestMapping("/api/rules")
@RequiredArgsConstructor
@Slf4j
public class RuleController {

    private final BudgetLedger ledger;

    @PostMapping
    public ResponseEntity<SeriesResponse> createRule(@Valid @RequestBody CreateRuleRequest request) {
        LocalDate startDate = IsoDates.parseDate(request.getStartDate(), "start_date");
        YearMonth referenceMonth = IsoDates.parseOptionalMonth(request.getReferenceMonth(), "reference_month");

        log.info("Creating recurring series: start={}, every {} {}, amount={}",
                startDate, request.getEveryN(), request.getUnit(), request.getAmountMinorUnits());

        SeriesCreation creation = ledger.createRecurringEntry(
            startDate,
            request.getAmountMinorUnits(),
            request.getNote(),
            request.getEveryN(),
            request.getUnit(),
            referenceMonth
        ).getOrThrow();

        return ResponseEntity.status(HttpStatus.CREATED).body(SeriesResponse.from(creation));
    }

    @GetMapping
    public ResponseEntity<List<RuleResponse>> listRules() {
        return ResponseEntity.ok(ledger.listRules().stream().map(RuleResponse::from).toList());
    }

    @GetMapping("/{id}")
    public ResponseEntity<RuleResponse> getRule(@PathVariable("id") long id) {
        return ledger.getRule(id)
            .map(rule -> ResponseEntity.ok(RuleResponse.from(rule)))
            .orElseThrow(() -> LedgerException.ruleNotFound(id));
    }

    @GetMapping("/{id}/entries")
    public ResponseEntity<List<EntryResponse>> listEntries(@PathVariable("id") long id) {
        if (ledger.getRule(id).isEmpty()) {
            throw LedgerException.ruleNotFound(id);
        }
        return ResponseEntity.ok(ledger.listEntriesForRule(id).stream().map(EntryResponse::from).toList());
    }

    /**
     * Expands one rule. A rule that does not exist is reported with
     * rule_found=false rather than 404, matching the engine's no-op contract.
     */
    @PostMapping("/{id}/generate")
    public ResponseEntity<GenerationResponse> generate(@PathVariable("id") long id,
                                                       @RequestParam("until") String until) {
        LocalDate horizon = IsoDates.parseDate(until, "until");
        GenerationResult result = ledger.generateUntil(id, horizon).getOrThrow();
        return ResponseEntity.ok(GenerationResponse.from(result));
    }

    @PostMapping("/{id}/coalesce")
    public ResponseEntity<ReconciliationResponse> coalesce(@PathVariable("id") long id) {
        ReconciliationOutcome outcome = ledger.coalesceManualStart(id).getOrThrow();
        return ResponseEntity.ok(new ReconciliationResponse(id, outcome));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<RuleDeletionResponse> deleteRule(@PathVariable("id") long id) {
        int removed = ledger.deleteRuleAndEntries(id).getOrThrow();
        return ResponseEntity.ok(new RuleDeletionResponse(id, removed));
    }
}
