package com.bank_ledger_sync.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;

import java.math.BigDecimal;
import java.util.List;

@Builder
public record AccountReport(
        @JsonProperty("account_id") String accountId,
        @JsonProperty("ledger_account") String ledgerAccount,
        @JsonProperty("reconciled") int reconciled,   // exact TXID hits
        @JsonProperty("matched") int matched,         // fuzzy hits on existing splits
        @JsonProperty("created") int created,         // new entries
        @JsonProperty("skipped") int skipped,
        @JsonProperty("expected_balance") BigDecimal expectedBalance,
        @JsonProperty("ledger_balance") BigDecimal ledgerBalance,
        @JsonProperty("warnings") List<ReconciliationWarning> warnings
) {
    public int warningCount() {
        return warnings == null ? 0 : warnings.size();
    }
}
