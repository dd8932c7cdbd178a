package com.bank_ledger_sync.aggregator.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

// token/new/ returns both tokens, token/refresh/ only the access pair
@JsonIgnoreProperties(ignoreUnknown = true)
public record TokenPairResponse(
        String access,
        @JsonProperty("access_expires") long accessExpires,
        String refresh,
        @JsonProperty("refresh_expires") Long refreshExpires
) {}
