package com.bank_ledger_sync.ledger;

import com.fasterxml.jackson.annotation.JsonBackReference;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.*;

import java.math.BigDecimal;

// two splits with equal fields are still different legs, so no value based equals
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
public class LedgerSplit {

    @JsonProperty("id")
    private String id;

    @JsonBackReference
    private LedgerEntry entry;

    // full name of the target account
    @JsonProperty("account")
    private String account;

    // in the entry's currency
    @JsonProperty("value")
    private BigDecimal value;

    // in the account's commodity, always equal to value in a single currency book
    @JsonProperty("quantity")
    private BigDecimal quantity;

    @JsonProperty("memo")
    @Builder.Default
    private String memo = "";

    @JsonProperty("reconcile_state")
    @Builder.Default
    private ReconcileState reconcileState = ReconcileState.UNRECONCILED;

    @Override
    public String toString() {
        return "LedgerSplit(" + id + ", " + account + ", " + value + ", '" + memo + "', " + reconcileState + ")";
    }
}
