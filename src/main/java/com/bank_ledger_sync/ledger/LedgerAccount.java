package com.bank_ledger_sync.ledger;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.*;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LedgerAccount {

    // dot separated path from the root, e.g. "Assets.Current Account"
    @JsonProperty("full_name")
    private String fullName;

    @JsonProperty("type")
    private String type;     // BANK, EXPENSE, INCOME, ...
}
