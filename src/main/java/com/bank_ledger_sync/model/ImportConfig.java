package com.bank_ledger_sync.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.*;

import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonPropertyOrder(alphabetic = true)
public class ImportConfig {

    @JsonProperty("secret_id")
    private String secretId;

    @JsonProperty("secret_key")
    private String secretKey;

    // refresh token
    @JsonProperty("token")
    private String token;

    // ledger file path -> aggregator account id -> mapping
    @JsonProperty("accounts")
    @Builder.Default
    private Map<String, Map<String, AccountMapping>> accounts = new LinkedHashMap<>();

    public Set<String> allAccountIds() {
        Set<String> ids = new LinkedHashSet<>();
        accounts.values().forEach(byId -> ids.addAll(byId.keySet()));
        return ids;
    }

    public boolean hasCredentials() {
        return secretId != null && !secretId.isBlank() && secretKey != null && !secretKey.isBlank();
    }
}
