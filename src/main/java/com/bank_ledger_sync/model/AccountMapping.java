package com.bank_ledger_sync.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.*;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonPropertyOrder(alphabetic = true)
public class AccountMapping {

    // full ledger path, e.g. "Assets.Current Account"; older config files call it gc_account
    @JsonProperty("ledger_account")
    @JsonAlias("gc_account")
    private String ledgerAccount;

    @JsonProperty("date_key")
    @Builder.Default
    private DateKey dateKey = DateKey.BOOKING_DATE;

    // recorded at registration, informational only
    @JsonProperty("iban")
    private String iban;

    @JsonProperty("inst")
    private String institutionId;
}
