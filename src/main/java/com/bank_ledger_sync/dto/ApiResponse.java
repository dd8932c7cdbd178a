package com.bank_ledger_sync.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;

@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ApiResponse<T>(
        @JsonProperty("success") boolean success,
        @JsonProperty("data") T data,
        @JsonProperty("error_code") String errorCode,
        @JsonProperty("error") String error,
        @JsonProperty("reconfirmation_url") String reconfirmationUrl
) {
    public static <T> ApiResponse<T> ok(T data) {
        return ApiResponse.<T>builder().success(true).data(data).build();
    }

    public static <T> ApiResponse<T> fail(String errorCode, String message) {
        return ApiResponse.<T>builder().errorCode(errorCode).error(message).build();
    }

    public static <T> ApiResponse<T> reconfirm(String message, String reconfirmationUrl) {
        return ApiResponse.<T>builder()
                .errorCode("RECONFIRMATION_REQUIRED")
                .error(message)
                .reconfirmationUrl(reconfirmationUrl)
                .build();
    }
}
