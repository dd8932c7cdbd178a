package com.bank_ledger_sync.controller;

import com.bank_ledger_sync.dto.*;
import com.bank_ledger_sync.model.AccountMapping;
import com.bank_ledger_sync.service.ImportService;
import com.bank_ledger_sync.service.TokenService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;

import java.util.Map;

@RestController
@RequiredArgsConstructor
@RequestMapping("/api/v1")
public class ImportController {

    private final ImportService importService;

    private final TokenService tokenService;

    @PostMapping("/import")
    @ResponseStatus(HttpStatus.OK)
    public Mono<ApiResponse<ImportReport>> importTransactions() {
        return importService.importTransactions()
                .map(ApiResponse::ok);
    }

    @PostMapping("/token")
    @ResponseStatus(HttpStatus.OK)
    public Mono<ApiResponse<TokenStatusResponse>> newToken(@RequestBody(required = false) TokenRequest request) {
        if (request == null) request = new TokenRequest();

        return tokenService.newToken(request.getSecretId(), request.getSecretKey())
                .map(pair -> ApiResponse.ok(TokenStatusResponse.builder()
                        .accessExpiresIn(pair.accessExpires())
                        .refreshExpiresIn(pair.refreshExpires())
                        .message("Token stored")
                        .build()));
    }

    @GetMapping("/accounts")
    @ResponseStatus(HttpStatus.OK)
    public Mono<ApiResponse<Map<String, Map<String, AccountMapping>>>> accounts() {
        return importService.configuredAccounts()
                .map(ApiResponse::ok);
    }
}
