package com.bank_ledger_sync.ledger;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.*;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LedgerBook {

    @JsonProperty("currencies")
    @Builder.Default
    private List<LedgerCurrency> currencies = new ArrayList<>();

    @JsonProperty("accounts")
    @Builder.Default
    private List<LedgerAccount> accounts = new ArrayList<>();

    @JsonProperty("entries")
    @Builder.Default
    private List<LedgerEntry> entries = new ArrayList<>();

    public Optional<LedgerAccount> findAccount(String fullName) {
        return accounts.stream().filter(a -> a.getFullName().equals(fullName)).findFirst();
    }

    public Optional<LedgerCurrency> findCurrency(String code) {
        return currencies.stream().filter(c -> c.getCode().equalsIgnoreCase(code)).findFirst();
    }
}
