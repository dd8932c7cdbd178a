package com.bank_ledger_sync.ledger;

import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.nio.file.Path;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Consumer;

@Slf4j
public class LedgerBookSession implements LedgerSession {

    private final LedgerBook book;
    private final Path file;
    private final Consumer<LedgerBook> writer;
    private boolean closed;

    public LedgerBookSession(LedgerBook book, Path file, Consumer<LedgerBook> writer) {
        this.book = book;
        this.file = file;
        this.writer = writer;
    }

    /** A session whose {@link #save()} keeps everything in memory. */
    public static LedgerBookSession inMemory(LedgerBook book) {
        return new LedgerBookSession(book, null, b -> { });
    }

    public LedgerBook book() {
        return book;
    }

    @Override
    public Path file() {
        return file;
    }

    @Override
    public Optional<LedgerAccount> lookupAccount(String fullName) {
        return book.findAccount(fullName);
    }

    @Override
    public List<LedgerSplit> listSplits(LedgerAccount account) {
        List<LedgerSplit> out = new ArrayList<>();
        for (LedgerEntry entry : book.getEntries()) {
            for (LedgerSplit split : entry.getSplits()) {
                if (account.getFullName().equals(split.getAccount())) {
                    out.add(split);
                }
            }
        }
        out.sort(Comparator.comparing((LedgerSplit s) -> s.getEntry().getDate(),
                Comparator.nullsFirst(Comparator.<LocalDate>naturalOrder())));
        return out;
    }

    @Override
    public Optional<LedgerCurrency> lookupCurrency(String code) {
        return code == null ? Optional.empty() : book.findCurrency(code);
    }

    @Override
    public EntryEdit beginEntry(LedgerCurrency currency) {
        ensureOpen();
        return new PendingEntry(currency);
    }

    @Override
    public BigDecimal getBalance(LedgerAccount account) {
        return listSplits(account).stream()
                .map(s -> s.getQuantity() != null ? s.getQuantity() : s.getValue())
                .reduce(BigDecimal.ZERO, BigDecimal::add);
    }

    @Override
    public void save() {
        ensureOpen();
        writer.accept(book);
    }

    @Override
    public void close() {
        closed = true;
    }

    private void ensureOpen() {
        if (closed) {
            throw new IllegalStateException("Ledger session already closed: " + file);
        }
    }

    private class PendingEntry implements EntryEdit {

        private final LedgerCurrency currency;
        private final LedgerEntry entry;
        private boolean done;

        PendingEntry(LedgerCurrency currency) {
            this.currency = currency;
            this.entry = LedgerEntry.builder()
                    .id(UUID.randomUUID().toString())
                    .currency(currency.getCode())
                    .description("")
                    .build();
        }

        @Override
        public LedgerSplit addSplit(LedgerAccount account, BigDecimal value, String memo) {
            ensurePending();
            BigDecimal rounded = value.setScale(currency.getFractionDigits(), RoundingMode.HALF_EVEN);
            LedgerSplit split = LedgerSplit.builder()
                    .id(UUID.randomUUID().toString())
                    .account(account.getFullName())
                    .value(rounded)
                    .quantity(rounded)
                    .memo(memo == null ? "" : memo)
                    .build();
            entry.addSplit(split);
            return split;
        }

        @Override
        public void setDate(LocalDate date) {
            ensurePending();
            entry.setDate(date);
        }

        @Override
        public void setDescription(String description) {
            ensurePending();
            entry.setDescription(description);
        }

        @Override
        public LedgerEntry commit() {
            ensurePending();
            if (entry.getDate() == null) {
                throw new IllegalStateException("Entry " + entry.getId() + " has no date");
            }
            book.getEntries().add(entry);
            done = true;
            return entry;
        }

        @Override
        public void close() {
            if (!done) {
                log.debug("Discarding uncommitted entry {} with {} splits", entry.getId(), entry.getSplits().size());
                done = true;
            }
        }

        private void ensurePending() {
            ensureOpen();
            if (done) {
                throw new IllegalStateException("Entry " + entry.getId() + " is no longer being edited");
            }
        }
    }
}
