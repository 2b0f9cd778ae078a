package com.flagship.budget_ledger.web.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

@Value
public class RuleDeletionResponse {

    @JsonProperty("rule_id")
    long ruleId;

    @JsonProperty("entries_removed")
    int entriesRemoved;
}
