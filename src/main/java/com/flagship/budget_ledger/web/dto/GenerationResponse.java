package com.flagship.budget_ledger.web.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.budget_ledger.recurrence.GenerationResult;
import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;

@Value
@Builder
public class GenerationResponse {

    @JsonProperty("rule_id")
    long ruleId;

    @JsonProperty("rule_found")
    boolean ruleFound;

    @JsonProperty("occurrences_produced")
    int occurrencesProduced;

    @JsonProperty("last_generated_date")
    LocalDate lastGeneratedDate;

    public static GenerationResponse from(GenerationResult result) {
        return GenerationResponse.builder()
            .ruleId(result.getRuleId())
            .ruleFound(result.isRuleFound())
            .occurrencesProduced(result.getOccurrencesProduced())
            .lastGeneratedDate(result.getCursor().orElse(null))
            .build();
    }
}
