package com.bank_ledger_sync.aggregator.dto;

import com.bank_ledger_sync.model.DateKey;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.math.BigDecimal;
import java.time.LocalDate;

@JsonIgnoreProperties(ignoreUnknown = true)
public record AggregatorTransaction(
        String internalTransactionId,   // stable per aggregator transaction, the dedup key
        String transactionId,           // bank supplied, often missing
        LocalDate bookingDate,
        LocalDate valueDate,
        String remittanceInformationUnstructured,
        Amount transactionAmount
) {
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Amount(BigDecimal amount, String currency) {}

    public LocalDate date(DateKey key) {
        LocalDate picked = key == DateKey.VALUE_DATE ? valueDate : bookingDate;
        // some banks only populate one of the two
        return picked != null ? picked : (bookingDate != null ? bookingDate : valueDate);
    }

    public BigDecimal amount() {
        return transactionAmount == null ? null : transactionAmount.amount();
    }

    public String currency() {
        return transactionAmount == null ? null : transactionAmount.currency();
    }

    public String description() {
        return remittanceInformationUnstructured == null ? "" : remittanceInformationUnstructured;
    }
}
