package com.bank_ledger_sync.controller;

import com.bank_ledger_sync.aggregator.dto.TokenPairResponse;
import com.bank_ledger_sync.dto.AccountReport;
import com.bank_ledger_sync.dto.ImportReport;
import com.bank_ledger_sync.dto.LedgerFileReport;
import com.bank_ledger_sync.exception.MissingCredentialsException;
import com.bank_ledger_sync.exception.NoBalanceAvailableException;
import com.bank_ledger_sync.exception.ReconfirmationRequiredException;
import com.bank_ledger_sync.model.AccountMapping;
import com.bank_ledger_sync.service.ImportService;
import com.bank_ledger_sync.service.TokenService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.test.web.reactive.server.WebTestClient;
import reactor.core.publisher.Mono;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.hamcrest.Matchers.containsString;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("ImportController")
class ImportControllerTest {

    @Mock
    private ImportService importService;

    @Mock
    private TokenService tokenService;

    private WebTestClient webTestClient;

    @BeforeEach
    void setUp() {
        webTestClient = WebTestClient
                .bindToController(new ImportController(importService, tokenService))
                .controllerAdvice(new GlobalExceptionHandler())
                .build();
    }

    @Test
    @DisplayName("Should return the import report")
    void shouldRunImport() {
        AccountReport account = AccountReport.builder()
                .accountId("acc-1")
                .ledgerAccount("Assets.Current Account")
                .created(2)
                .expectedBalance(new BigDecimal("85.00"))
                .ledgerBalance(new BigDecimal("85.00"))
                .warnings(List.of())
                .build();
        ImportReport report = ImportReport.builder()
                .accountsDownloaded(1)
                .ledgerFiles(List.of(LedgerFileReport.builder()
                        .ledgerFile("/books/home.json")
                        .status(LedgerFileReport.Status.OK)
                        .accounts(List.of(account))
                        .build()))
                .build();
        when(importService.importTransactions()).thenReturn(Mono.just(report));

        webTestClient.post().uri("/api/v1/import")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.success").isEqualTo(true)
                .jsonPath("$.data.accounts_downloaded").isEqualTo(1)
                .jsonPath("$.data.ledger_files[0].status").isEqualTo("OK")
                .jsonPath("$.data.ledger_files[0].accounts[0].ledger_account").isEqualTo("Assets.Current Account")
                .jsonPath("$.data.ledger_files[0].accounts[0].created").isEqualTo(2);
    }

    @Test
    @DisplayName("Should answer 409 with the reconfirmation link when an agreement expired")
    void shouldReportReconfirmation() {
        when(importService.importTransactions()).thenReturn(Mono.error(
                new ReconfirmationRequiredException("acc-1", "agr-1", "https://ob.example/reconfirm/agr-1")));

        webTestClient.post().uri("/api/v1/import")
                .exchange()
                .expectStatus().isEqualTo(409)
                .expectBody()
                .jsonPath("$.success").isEqualTo(false)
                .jsonPath("$.error_code").isEqualTo("RECONFIRMATION_REQUIRED")
                .jsonPath("$.reconfirmation_url").isEqualTo("https://ob.example/reconfirm/agr-1")
                .jsonPath("$.error").value(containsString("https://ob.example/reconfirm/agr-1"));
    }

    @Test
    @DisplayName("Should answer 502 when the bank reports no usable balance")
    void shouldReportMissingBalance() {
        when(importService.importTransactions())
                .thenReturn(Mono.error(new NoBalanceAvailableException("acc-1", Set.of("forwardAvailable"))));

        webTestClient.post().uri("/api/v1/import")
                .exchange()
                .expectStatus().isEqualTo(502)
                .expectBody()
                .jsonPath("$.success").isEqualTo(false)
                .jsonPath("$.error_code").isEqualTo("NO_BALANCE");
    }

    @Test
    @DisplayName("Should store a new token without echoing it")
    void shouldRequestToken() {
        when(tokenService.newToken("id-1", "key-1"))
                .thenReturn(Mono.just(new TokenPairResponse("access-1", 86400, "refresh-1", 2592000L)));

        webTestClient.post().uri("/api/v1/token")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("{\"secret_id\": \"id-1\", \"secret_key\": \"key-1\"}")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.data.access_expires_in").isEqualTo(86400)
                .jsonPath("$.data.refresh_expires_in").isEqualTo(2592000)
                .jsonPath("$.data.message").isEqualTo("Token stored")
                .jsonPath("$.data.access").doesNotExist();
    }

    @Test
    @DisplayName("Should answer 400 when no credentials are available")
    void shouldRejectTokenWithoutCredentials() {
        when(tokenService.newToken(isNull(), isNull()))
                .thenReturn(Mono.error(new MissingCredentialsException("No aggregator secret id/key configured")));

        webTestClient.post().uri("/api/v1/token")
                .exchange()
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.error_code").isEqualTo("MISSING_CREDENTIALS")
                .jsonPath("$.error").isEqualTo("No aggregator secret id/key configured");
    }

    @Test
    @DisplayName("Should list configured account mappings")
    void shouldListAccounts() {
        when(importService.configuredAccounts()).thenReturn(Mono.just(Map.of(
                "/books/home.json", Map.of("acc-1", AccountMapping.builder().ledgerAccount("Assets.Current Account").build()))));

        webTestClient.get().uri("/api/v1/accounts")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.data['/books/home.json']['acc-1'].ledger_account").isEqualTo("Assets.Current Account")
                .jsonPath("$.data['/books/home.json']['acc-1'].date_key").isEqualTo("bookingDate");
    }
}
