package com.bank_ledger_sync.exception;

import lombok.Getter;

@Getter
public class AccountNotFoundException extends LedgerFileException {

    private final String accountPath;

    public AccountNotFoundException(String accountPath) {
        super("Account name not found: " + accountPath);
        this.accountPath = accountPath;
    }
}
