package com.bank_ledger_sync.exception;

import lombok.Getter;

@Getter
public class DivisionUndefinedException extends LedgerFileException {

    private final String description;

    public DivisionUndefinedException(String description, String previousEntryId) {
        super("Cannot copy splits for '" + description + "': previous split in entry "
                + previousEntryId + " has zero value");
        this.description = description;
    }
}
