package com.bank_ledger_sync.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;

@Data
public class TokenRequest {

    // both optional, the stored credentials are used when missing
    @JsonProperty("secret_id")
    private String secretId;

    @JsonProperty("secret_key")
    private String secretKey;
}
