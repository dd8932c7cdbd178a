package com.bank_ledger_sync.ledger;

public enum ReconcileState {
    UNRECONCILED,
    CLEARED,
    RECONCILED
}
