package com.bank_ledger_sync.exception;

import lombok.Getter;

import java.util.Set;

@Getter
public class NoBalanceAvailableException extends RuntimeException {

    private final String accountId;

    public NoBalanceAvailableException(String accountId, Set<String> presentTypes) {
        super("No usable balance for account " + accountId + ", got types " + presentTypes);
        this.accountId = accountId;
    }
}
