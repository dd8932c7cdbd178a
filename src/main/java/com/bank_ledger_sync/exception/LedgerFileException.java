package com.bank_ledger_sync.exception;

// stops reconciliation of one ledger file without saving it; other files still run
public abstract class LedgerFileException extends RuntimeException {

    protected LedgerFileException(String message) {
        super(message);
    }

    protected LedgerFileException(String message, Throwable cause) {
        super(message, cause);
    }
}
