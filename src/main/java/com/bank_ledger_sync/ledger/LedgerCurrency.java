package com.bank_ledger_sync.ledger;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.*;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LedgerCurrency {

    @JsonProperty("code")
    private String code;       // ISO 4217

    // smallest commodity unit, split values are rounded to this many decimals
    @JsonProperty("fraction_digits")
    @Builder.Default
    private int fractionDigits = 2;
}
