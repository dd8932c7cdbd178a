package com.bank_ledger_sync.service;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

// existing ledgers depend on this exact memo text
public final class SplitAnnotation {

    private static final Pattern TXID = Pattern.compile("TXID: (.+?)(;|$)");
    private static final Pattern TXNAME = Pattern.compile("TXNAME: (.+?)(;|$)");

    private SplitAnnotation() {
    }

    public static Optional<String> txid(String memo) {
        return find(TXID, memo);
    }

    public static Optional<String> txname(String memo) {
        return find(TXNAME, memo);
    }

    public static String format(String txid, String txname) {
        return "TXID: " + txid + "; TXNAME: " + txname + ";";
    }

    /** Appends the tags after any existing memo text. */
    public static String append(String memo, String txid, String txname) {
        String prefix = (memo == null || memo.isEmpty()) ? "" : memo + "; ";
        return prefix + format(txid, txname);
    }

    private static Optional<String> find(Pattern pattern, String memo) {
        if (memo == null) return Optional.empty();
        Matcher m = pattern.matcher(memo);
        return m.find() ? Optional.of(m.group(1)) : Optional.empty();
    }
}
