package com.bank_ledger_sync.ledger;

import java.math.BigDecimal;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

/**
 * An open ledger. Existing splits returned by {@link #listSplits} are live objects,
 * mutating their memo, reconcile state or entry date edits the ledger directly.
 * New entries go through {@link #beginEntry}.
 */
public interface LedgerSession extends AutoCloseable {

    Path file();

    Optional<LedgerAccount> lookupAccount(String fullName);

    /** Splits booked against {@code account}, ordered by entry date (stable). */
    List<LedgerSplit> listSplits(LedgerAccount account);

    Optional<LedgerCurrency> lookupCurrency(String code);

    EntryEdit beginEntry(LedgerCurrency currency);

    /** Sum of the quantities of every split in {@code account}. */
    BigDecimal getBalance(LedgerAccount account);

    void save();

    @Override
    void close();
}
