package com.flagship.budget_ledger.web.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.budget_ledger.api.SeriesCreation;
import com.flagship.budget_ledger.reconciliation.ReconciliationOutcome;
import lombok.Builder;
import lombok.Value;

/**
 * Response DTO for a newly created recurring series.
 */
@Value
@Builder
public class SeriesResponse {

    @JsonProperty("rule")
    RuleResponse rule;

    @JsonProperty("reconciliation")
    ReconciliationOutcome reconciliation;

    @JsonProperty("occurrences_generated")
    int occurrencesGenerated;

    public static SeriesResponse from(SeriesCreation creation) {
        return SeriesResponse.builder()
            .rule(RuleResponse.from(creation.getRule()))
            .reconciliation(creation.getReconciliation())
            .occurrencesGenerated(creation.getGeneration().getOccurrencesProduced())
            .build();
    }
}
