package com.bank_ledger_sync.model;

import com.bank_ledger_sync.aggregator.dto.AggregatorTransactionsResponse.TransactionsGroup;
import lombok.Builder;

import java.math.BigDecimal;

@Builder
public record AccountDownload(
        String accountId,
        BigDecimal balance,
        String balanceType,
        TransactionsGroup transactions
) {}
