package com.bank_ledger_sync.exception;

import lombok.Getter;

@Getter
public class UnknownCurrencyException extends LedgerFileException {

    private final String currencyCode;

    public UnknownCurrencyException(String currencyCode) {
        super("Currency not in the ledger's commodity table: " + currencyCode);
        this.currencyCode = currencyCode;
    }
}
