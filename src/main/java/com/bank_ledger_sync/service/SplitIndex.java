package com.bank_ledger_sync.service;

import com.bank_ledger_sync.ledger.LedgerSplit;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

// the untagged pool shrinks as splits get matched, so an index is good for one pass over one account
@Slf4j
final class SplitIndex {

    private final Map<String, LedgerSplit> byTxid = new LinkedHashMap<>();
    private final List<LedgerSplit> untagged = new ArrayList<>();
    // oldest first, the last element is the latest occurrence
    private final Map<String, List<LedgerSplit>> byName = new HashMap<>();

    private SplitIndex() {
    }

    static SplitIndex build(String account, List<LedgerSplit> splits) {
        SplitIndex index = new SplitIndex();
        for (LedgerSplit split : splits) {
            Optional<String> txid = SplitAnnotation.txid(split.getMemo());
            if (txid.isEmpty()) {
                index.untagged.add(split);
                continue;
            }
            LedgerSplit first = index.byTxid.putIfAbsent(txid.get(), split);
            if (first != null) {
                log.warn("Account {} has more than one split tagged TXID {}, keeping {} and ignoring {}",
                        account, txid.get(), first.getId(), split.getId());
            }
        }
        for (LedgerSplit split : index.byTxid.values()) {
            SplitAnnotation.txname(split.getMemo())
                    .ifPresent(name -> index.byName.computeIfAbsent(name, k -> new ArrayList<>()).add(split));
        }
        Comparator<LedgerSplit> byEntryDate = Comparator.comparing((LedgerSplit s) -> s.getEntry().getDate(),
                Comparator.nullsFirst(Comparator.<LocalDate>naturalOrder()));
        index.byName.values().forEach(group -> group.sort(byEntryDate));
        return index;
    }

    Optional<LedgerSplit> tagged(String txid) {
        return Optional.ofNullable(byTxid.get(txid));
    }

    // ties go to the earlier split in the list
    Optional<LedgerSplit> closestUntagged(BigDecimal amount, LocalDate date, int windowDays) {
        LedgerSplit best = null;
        long bestDistance = Long.MAX_VALUE;
        for (LedgerSplit split : untagged) {
            LocalDate entryDate = split.getEntry().getDate();
            if (entryDate == null || !Amounts.isClose(split.getValue(), amount)) continue;
            long distance = Math.abs(ChronoUnit.DAYS.between(entryDate, date));
            if (distance <= windowDays && distance < bestDistance) {
                best = split;
                bestDistance = distance;
            }
        }
        return Optional.ofNullable(best);
    }

    Optional<LedgerSplit> latestNamed(String txname) {
        List<LedgerSplit> group = byName.get(txname);
        return (group == null || group.isEmpty()) ? Optional.empty() : Optional.of(group.get(group.size() - 1));
    }

    void claim(LedgerSplit split, String txid) {
        untagged.remove(split);
        byTxid.put(txid, split);
    }

    void register(LedgerSplit split, String txid) {
        byTxid.put(txid, split);
    }

    int untaggedCount() {
        return untagged.size();
    }

    int taggedCount() {
        return byTxid.size();
    }
}
