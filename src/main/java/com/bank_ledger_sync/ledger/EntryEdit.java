package com.bank_ledger_sync.ledger;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * Edit scope for a new entry. Nothing is visible in the ledger until {@link #commit()};
 * {@link #close()} without a commit drops the entry and all its splits.
 */
public interface EntryEdit extends AutoCloseable {

    /** Adds a split, its value rounded to the entry currency's fraction digits. */
    LedgerSplit addSplit(LedgerAccount account, BigDecimal value, String memo);

    void setDate(LocalDate date);

    void setDescription(String description);

    LedgerEntry commit();

    @Override
    void close();
}
