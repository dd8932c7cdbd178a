package com.bank_ledger_sync.aggregator.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonIgnoreProperties(ignoreUnknown = true)
public record AgreementErrorResponse(
        String summary,
        String detail,
        @JsonProperty("status_code") Integer statusCode
) {}
