package com.bank_ledger_sync.config;

import jakarta.validation.constraints.Min;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Data
@Validated
@ConfigurationProperties(prefix = "ledger-sync")
public class ReconcileProperties {
    // inclusive, in calendar days either side of the transaction date
    @Min(0)
    private int matchWindowDays = 5;
}
