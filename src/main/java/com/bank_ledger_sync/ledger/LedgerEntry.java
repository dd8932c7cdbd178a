package com.bank_ledger_sync.ledger;

import com.fasterxml.jackson.annotation.JsonManagedReference;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.*;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
public class LedgerEntry {

    @JsonProperty("id")
    private String id;

    @JsonProperty("date")
    private LocalDate date;

    @JsonProperty("description")
    private String description;

    // currency code, must exist in the book's commodity table
    @JsonProperty("currency")
    private String currency;

    @JsonProperty("splits")
    @JsonManagedReference
    @Builder.Default
    private List<LedgerSplit> splits = new ArrayList<>();

    public void addSplit(LedgerSplit split) {
        split.setEntry(this);
        splits.add(split);
    }

    @Override
    public String toString() {
        return "LedgerEntry(" + id + ", " + date + ", '" + description + "', " + splits.size() + " splits)";
    }
}
