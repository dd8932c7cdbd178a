package com.bank_ledger_sync.exception;

import java.nio.file.Path;

public class LedgerIoException extends LedgerFileException {
    public LedgerIoException(Path file, Throwable cause) {
        super("Cannot read or write ledger file " + file + ": " + cause.getMessage(), cause);
    }
}
