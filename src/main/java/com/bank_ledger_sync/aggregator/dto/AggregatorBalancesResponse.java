package com.bank_ledger_sync.aggregator.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public record AggregatorBalancesResponse(
        List<Balance> balances
) {
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Balance(
            BalanceAmount balanceAmount,
            String balanceType,        // expectedClosed, interimBooked, closingBooked, ...
            LocalDate referenceDate
    ) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record BalanceAmount(BigDecimal amount, String currency) {}
}
