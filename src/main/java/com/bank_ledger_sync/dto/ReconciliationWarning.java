package com.bank_ledger_sync.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;

import java.math.BigDecimal;

@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ReconciliationWarning(
        @JsonProperty("kind") Kind kind,
        @JsonProperty("account_id") String accountId,
        @JsonProperty("ledger_account") String ledgerAccount,
        @JsonProperty("transaction_id") String transactionId,   // null for balance warnings
        @JsonProperty("expected") BigDecimal expected,
        @JsonProperty("actual") BigDecimal actual,
        @JsonProperty("message") String message
) {
    public enum Kind {
        AMOUNT_MISMATCH,
        BALANCE_DIVERGENCE
    }
}
