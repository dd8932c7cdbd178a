package com.bank_ledger_sync.controller;

import com.bank_ledger_sync.dto.ApiResponse;
import com.bank_ledger_sync.exception.AggregatorTransportException;
import com.bank_ledger_sync.exception.ConfigException;
import com.bank_ledger_sync.exception.MissingCredentialsException;
import com.bank_ledger_sync.exception.NoBalanceAvailableException;
import com.bank_ledger_sync.exception.ReconfirmationRequiredException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    @ExceptionHandler(AggregatorTransportException.class)
    public ResponseEntity<ApiResponse<Void>> handleTransport(AggregatorTransportException e) {
        log.error("Aggregator request failed: {}", e.getMessage());
        return ResponseEntity.status(HttpStatus.BAD_GATEWAY).body(ApiResponse.fail("AGGREGATOR_ERROR", e.getMessage()));
    }

    @ExceptionHandler(NoBalanceAvailableException.class)
    public ResponseEntity<ApiResponse<Void>> handleNoBalance(NoBalanceAvailableException e) {
        log.error(e.getMessage());
        return ResponseEntity.status(HttpStatus.BAD_GATEWAY).body(ApiResponse.fail("NO_BALANCE", e.getMessage()));
    }

    @ExceptionHandler(ReconfirmationRequiredException.class)
    public ResponseEntity<ApiResponse<Void>> handleReconfirmation(ReconfirmationRequiredException e) {
        log.warn(e.getMessage());
        return ResponseEntity.status(HttpStatus.CONFLICT)
                .body(ApiResponse.reconfirm(e.getMessage(), e.getReconfirmationUrl()));
    }

    @ExceptionHandler(MissingCredentialsException.class)
    public ResponseEntity<ApiResponse<Void>> handleMissingCredentials(MissingCredentialsException e) {
        log.warn(e.getMessage());
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(ApiResponse.fail("MISSING_CREDENTIALS", e.getMessage()));
    }

    @ExceptionHandler(ConfigException.class)
    public ResponseEntity<ApiResponse<Void>> handleConfig(ConfigException e) {
        log.error(e.getMessage(), e);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(ApiResponse.fail("CONFIG_ERROR", e.getMessage()));
    }
}
