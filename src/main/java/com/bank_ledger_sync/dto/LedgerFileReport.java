package com.bank_ledger_sync.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;

import java.util.List;

@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public record LedgerFileReport(
        @JsonProperty("ledger_file") String ledgerFile,
        @JsonProperty("status") Status status,
        @JsonProperty("error") String error,
        @JsonProperty("accounts") List<AccountReport> accounts
) {
    public enum Status {
        OK,
        FAILED   // nothing was saved for this file
    }

    public static LedgerFileReport failed(String ledgerFile, String error) {
        return new LedgerFileReport(ledgerFile, Status.FAILED, error, List.of());
    }
}
