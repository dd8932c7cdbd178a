package com.bank_ledger_sync.ledger;

import java.nio.file.Path;

/** Opens ledger files for editing. */
public interface LedgerStore {

    /**
     * Opens the ledger at {@code file}. Changes stay in memory until
     * {@link LedgerSession#save()}; closing without saving discards them.
     */
    LedgerSession open(Path file);
}
