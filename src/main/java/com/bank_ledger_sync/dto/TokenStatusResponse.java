package com.bank_ledger_sync.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;

// token values themselves never leave the service
@Builder
public record TokenStatusResponse(
        @JsonProperty("access_expires_in") long accessExpiresIn,
        @JsonProperty("refresh_expires_in") Long refreshExpiresIn,
        @JsonProperty("message") String message
) {}
