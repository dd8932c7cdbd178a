package com.bank_ledger_sync.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;

import java.util.List;

@Builder
public record ImportReport(
        @JsonProperty("accounts_downloaded") int accountsDownloaded,
        @JsonProperty("ledger_files") List<LedgerFileReport> ledgerFiles,
        @JsonProperty("warning_count") int warningCount,
        @JsonProperty("failed_files") int failedFiles
) {}
