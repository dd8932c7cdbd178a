package com.bank_ledger_sync.aggregator.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;
import java.util.Optional;

@JsonIgnoreProperties(ignoreUnknown = true)
public record AggregatorTransactionsResponse(
        TransactionsGroup transactions
) {
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record TransactionsGroup(
            List<AggregatorTransaction> booked,
            List<AggregatorTransaction> pending
    ) {
        public TransactionsGroup {
            booked = Optional.ofNullable(booked).orElse(List.of());
            pending = Optional.ofNullable(pending).orElse(List.of());
        }
    }
}
