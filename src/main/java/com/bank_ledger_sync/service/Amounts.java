package com.bank_ledger_sync.service;

import java.math.BigDecimal;

final class Amounts {

    // relative tolerance, no absolute floor
    private static final BigDecimal REL_TOL = new BigDecimal("1e-9");

    private Amounts() {
    }

    static boolean isClose(BigDecimal a, BigDecimal b) {
        if (a == null || b == null) return false;
        if (a.compareTo(b) == 0) return true;
        BigDecimal diff = a.subtract(b).abs();
        BigDecimal largest = a.abs().max(b.abs());
        return diff.compareTo(largest.multiply(REL_TOL)) <= 0;
    }
}
