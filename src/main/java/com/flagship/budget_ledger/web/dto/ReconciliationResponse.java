package com.flagship.budget_ledger.web.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.budget_ledger.reconciliation.ReconciliationOutcome;
import lombok.Value;

@Value
public class ReconciliationResponse {

    @JsonProperty("rule_id")
    long ruleId;

    @JsonProperty("outcome")
    ReconciliationOutcome outcome;
}
