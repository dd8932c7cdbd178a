package com.bank_ledger_sync.service;

import com.bank_ledger_sync.aggregator.dto.AggregatorTransaction;
import com.bank_ledger_sync.config.ReconcileProperties;
import com.bank_ledger_sync.dto.AccountReport;
import com.bank_ledger_sync.dto.LedgerFileReport;
import com.bank_ledger_sync.dto.ReconciliationWarning;
import com.bank_ledger_sync.exception.AccountNotFoundException;
import com.bank_ledger_sync.exception.DivisionUndefinedException;
import com.bank_ledger_sync.exception.LedgerFileException;
import com.bank_ledger_sync.exception.UnknownCurrencyException;
import com.bank_ledger_sync.ledger.EntryEdit;
import com.bank_ledger_sync.ledger.LedgerAccount;
import com.bank_ledger_sync.ledger.LedgerCurrency;
import com.bank_ledger_sync.ledger.LedgerEntry;
import com.bank_ledger_sync.ledger.LedgerSession;
import com.bank_ledger_sync.ledger.LedgerSplit;
import com.bank_ledger_sync.ledger.LedgerStore;
import com.bank_ledger_sync.ledger.ReconcileState;
import com.bank_ledger_sync.model.AccountDownload;
import com.bank_ledger_sync.model.AccountMapping;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.MathContext;
import java.nio.file.Path;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Merges downloaded bank transactions into a ledger file. A record whose TXID is
 * already tagged is reconciled, an untagged split of the same amount close in date
 * is annotated, and anything else becomes a new entry copying the split layout of
 * the last entry with the same remittance text.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class ReconcileService {

    private final LedgerStore ledgerStore;
    private final ReconcileProperties props;

    // a LedgerFileException aborts the file without saving anything
    public LedgerFileReport reconcileFile(String ledgerFile,
                                          Map<String, AccountMapping> accounts,
                                          Map<String, AccountDownload> downloads) {
        try (LedgerSession session = ledgerStore.open(Path.of(ledgerFile))) {
            List<AccountOutcome> outcomes = new ArrayList<>();
            for (Map.Entry<String, AccountMapping> e : accounts.entrySet()) {
                AccountDownload download = downloads.get(e.getKey());
                if (download == null) {
                    log.warn("No download for account {} ({}), skipping", e.getKey(), e.getValue().getLedgerAccount());
                    continue;
                }
                outcomes.add(reconcileAccount(session, e.getKey(), e.getValue(), download.transactions().booked()));
            }

            // balances last: copied splits may land in another configured account of this file
            List<AccountReport> reports = new ArrayList<>();
            for (AccountOutcome outcome : outcomes) {
                verifyBalance(session, outcome, downloads.get(outcome.accountId).balance());
                reports.add(outcome.toReport());
            }

            session.save();
            return LedgerFileReport.builder()
                    .ledgerFile(ledgerFile)
                    .status(LedgerFileReport.Status.OK)
                    .accounts(reports)
                    .build();
        } catch (LedgerFileException e) {
            log.error("Reconciliation of {} aborted, file left unchanged: {}", ledgerFile, e.getMessage());
            return LedgerFileReport.failed(ledgerFile, e.getMessage());
        }
    }

    AccountOutcome reconcileAccount(LedgerSession session,
                                    String accountId,
                                    AccountMapping mapping,
                                    List<AggregatorTransaction> booked) {
        String path = mapping.getLedgerAccount();
        LedgerAccount account = session.lookupAccount(path)
                .orElseThrow(() -> new AccountNotFoundException(path));

        SplitIndex index = SplitIndex.build(path, session.listSplits(account));
        AccountOutcome outcome = new AccountOutcome(accountId, path);
        log.debug("Account {}: {} tagged, {} untagged splits, {} booked transactions",
                path, index.taggedCount(), index.untaggedCount(), booked.size());

        for (AggregatorTransaction tx : booked) {
            String txid = tx.internalTransactionId();
            if (txid == null || txid.isBlank()) {
                log.warn("Transaction without internalTransactionId on {}, skipping: {}", path, tx);
                outcome.skipped++;
                continue;
            }
            LocalDate date = tx.date(mapping.getDateKey());
            BigDecimal amount = tx.amount();
            if (date == null || amount == null) {
                log.warn("Transaction {} on {} has no date or amount, skipping", txid, path);
                outcome.skipped++;
                continue;
            }

            Optional<LedgerSplit> existing = index.tagged(txid);
            if (existing.isPresent()) {
                LedgerSplit split = existing.get();
                if (!Amounts.isClose(split.getValue(), amount)) {
                    outcome.warn(ReconciliationWarning.builder()
                            .kind(ReconciliationWarning.Kind.AMOUNT_MISMATCH)
                            .accountId(accountId)
                            .ledgerAccount(path)
                            .transactionId(txid)
                            .expected(amount)
                            .actual(split.getValue())
                            .message("Can't reconcile " + txid + " on " + path + " due to incorrect amounts: ledger has "
                                    + split.getValue() + ", bank reports " + amount)
                            .build());
                    outcome.skipped++;
                    continue;
                }
                split.setReconcileState(ReconcileState.RECONCILED);
                outcome.reconciled++;
                continue;
            }

            Optional<LedgerSplit> candidate = index.closestUntagged(amount, date, props.getMatchWindowDays());
            if (candidate.isPresent()) {
                LedgerSplit split = candidate.get();
                split.setMemo(SplitAnnotation.append(split.getMemo(), txid, tx.description()));
                split.getEntry().setDate(date);
                index.claim(split, txid);
                outcome.matched++;
                continue;
            }

            LedgerSplit created = createEntry(session, account, index, tx, date);
            index.register(created, txid);
            outcome.created++;
        }

        log.info("Account {}: {} reconciled, {} matched, {} created, {} skipped",
                path, outcome.reconciled, outcome.matched, outcome.created, outcome.skipped);
        return outcome;
    }

    private LedgerSplit createEntry(LedgerSession session,
                                    LedgerAccount account,
                                    SplitIndex index,
                                    AggregatorTransaction tx,
                                    LocalDate date) {
        LedgerCurrency currency = session.lookupCurrency(tx.currency())
                .orElseThrow(() -> new UnknownCurrencyException(tx.currency()));
        BigDecimal amount = tx.amount();

        try (EntryEdit edit = session.beginEntry(currency)) {
            edit.setDate(date);
            LedgerSplit primary = edit.addSplit(account, amount,
                    SplitAnnotation.format(tx.internalTransactionId(), tx.description()));

            String description = tx.description();
            Optional<LedgerSplit> previous = index.latestNamed(tx.description());
            if (previous.isPresent()) {
                LedgerSplit prevSplit = previous.get();
                LedgerEntry prevEntry = prevSplit.getEntry();
                BigDecimal prevTotal = prevSplit.getQuantity() != null ? prevSplit.getQuantity() : prevSplit.getValue();
                if (prevTotal.signum() == 0) {
                    throw new DivisionUndefinedException(tx.description(), prevEntry.getId());
                }
                for (LedgerSplit other : prevEntry.getSplits()) {
                    if (other == prevSplit) continue;
                    LedgerAccount target = session.lookupAccount(other.getAccount())
                            .orElseThrow(() -> new AccountNotFoundException(other.getAccount()));
                    BigDecimal scaled = amount.multiply(other.getValue()).divide(prevTotal, MathContext.DECIMAL64);
                    edit.addSplit(target, scaled, "");
                }
                description = prevEntry.getDescription();
            }

            edit.setDescription(description);
            edit.commit();
            return primary;
        }
    }

    private void verifyBalance(LedgerSession session, AccountOutcome outcome, BigDecimal expected) {
        LedgerAccount account = session.lookupAccount(outcome.ledgerAccount)
                .orElseThrow(() -> new AccountNotFoundException(outcome.ledgerAccount));
        BigDecimal actual = session.getBalance(account);
        outcome.expectedBalance = expected;
        outcome.ledgerBalance = actual;
        if (!Amounts.isClose(actual, expected)) {
            outcome.warn(ReconciliationWarning.builder()
                    .kind(ReconciliationWarning.Kind.BALANCE_DIVERGENCE)
                    .accountId(outcome.accountId)
                    .ledgerAccount(outcome.ledgerAccount)
                    .expected(expected)
                    .actual(actual)
                    .message(outcome.ledgerAccount + " balance out of sync, please reconcile. Expected: "
                            + expected + ", ledger: " + actual)
                    .build());
        }
    }

    static final class AccountOutcome {
        final String accountId;
        final String ledgerAccount;
        int reconciled;
        int matched;
        int created;
        int skipped;
        BigDecimal expectedBalance;
        BigDecimal ledgerBalance;
        final List<ReconciliationWarning> warnings = new ArrayList<>();

        AccountOutcome(String accountId, String ledgerAccount) {
            this.accountId = accountId;
            this.ledgerAccount = ledgerAccount;
        }

        void warn(ReconciliationWarning warning) {
            log.warn(warning.message());
            warnings.add(warning);
        }

        AccountReport toReport() {
            return AccountReport.builder()
                    .accountId(accountId)
                    .ledgerAccount(ledgerAccount)
                    .reconciled(reconciled)
                    .matched(matched)
                    .created(created)
                    .skipped(skipped)
                    .expectedBalance(expectedBalance)
                    .ledgerBalance(ledgerBalance)
                    .warnings(List.copyOf(warnings))
                    .build();
        }
    }
}
