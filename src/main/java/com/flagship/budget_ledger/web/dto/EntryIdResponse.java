package com.flagship.budget_ledger.web.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

@Value
public class EntryIdResponse {

    @JsonProperty("id")
    long id;
}
