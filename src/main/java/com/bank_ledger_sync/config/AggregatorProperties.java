package com.bank_ledger_sync.config;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Data
@Validated
@ConfigurationProperties(prefix = "aggregator")
public class AggregatorProperties {
    @NotBlank
    private String baseUrl = "https://bankaccountdata.gocardless.com/api/v2/";
    // JSON file holding credentials and the ledger-file -> account mappings
    @NotBlank
    private String configPath;
    private int connectTimeoutMillis = 5000;
    private int responseTimeoutMillis = 30000;
    @Min(1)
    private int maxConcurrency = 8;
    // refresh this many seconds before the access token actually expires
    private long tokenExpirySkewSeconds = 30;
}
