package com.bank_ledger_sync.service;

import com.bank_ledger_sync.config.AggregatorProperties;
import com.bank_ledger_sync.exception.AggregatorTransportException;
import com.bank_ledger_sync.exception.MissingCredentialsException;
import com.bank_ledger_sync.model.ImportConfig;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("TokenService")
class TokenServiceTest {

    private static final String NEW_PAIR = """
            {"access": "access-1", "access_expires": 86400, "refresh": "refresh-1", "refresh_expires": 2592000}""";
    private static final String REFRESHED = """
            {"access": "access-2", "access_expires": 86400}""";

    @TempDir
    Path tempDir;

    private final List<String> calls = Collections.synchronizedList(new ArrayList<>());
    private final Map<String, ClientResponse> responses = new ConcurrentHashMap<>();
    private volatile Duration latency = Duration.ZERO;
    private final MutableClock clock = new MutableClock(Instant.parse("2024-03-10T09:00:00Z"));

    private ConfigService configService;
    private TokenService tokenService;

    @BeforeEach
    void setUp() {
        AggregatorProperties props = new AggregatorProperties();
        props.setConfigPath(tempDir.resolve("gnucash-import").toString());
        configService = new ConfigService(new ObjectMapper(), props);

        WebClient webClient = WebClient.builder()
                .baseUrl("http://aggregator.test/api/v2/")
                .exchangeFunction(request -> {
                    String path = request.url().getPath();
                    calls.add(path);
                    ClientResponse response = responses.entrySet().stream()
                            .filter(e -> path.endsWith(e.getKey()))
                            .map(Map.Entry::getValue)
                            .findFirst()
                            .orElseGet(() -> json(HttpStatus.NOT_FOUND, "{}"));
                    return latency.isZero() ? Mono.just(response) : Mono.just(response).delayElement(latency);
                })
                .build();

        tokenService = new TokenService(webClient, configService, props, clock);
    }

    private static ClientResponse json(HttpStatus status, String body) {
        return ClientResponse.create(status)
                .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                .body(body)
                .build();
    }

    private void storeConfig(String secretId, String secretKey, String refreshToken) {
        configService.save(ImportConfig.builder()
                .secretId(secretId)
                .secretKey(secretKey)
                .token(refreshToken)
                .build());
    }

    @Test
    @DisplayName("Should request a new pair when no refresh token is stored and persist it")
    void shouldRequestNewPairWithoutRefreshToken() {
        // Given
        storeConfig("id-1", "key-1", null);
        responses.put("/token/new/", json(HttpStatus.OK, NEW_PAIR));

        // When / Then
        StepVerifier.create(tokenService.accessToken())
                .expectNext("access-1")
                .verifyComplete();

        assertThat(calls).containsExactly("/api/v2/token/new/");
        assertThat(configService.load().getToken()).isEqualTo("refresh-1");
    }

    @Test
    @DisplayName("Should serve the cached access token until shortly before it expires")
    void shouldCacheAccessToken() {
        // Given
        storeConfig("id-1", "key-1", null);
        responses.put("/token/new/", json(HttpStatus.OK, NEW_PAIR));
        StepVerifier.create(tokenService.accessToken()).expectNext("access-1").verifyComplete();

        // When
        clock.advanceSeconds(86400 - 31);
        String cached = tokenService.accessToken().block();

        // Then
        assertThat(cached).isEqualTo("access-1");
        assertThat(calls).hasSize(1);

        // once inside the skew window the stored refresh token is used
        responses.put("/token/refresh/", json(HttpStatus.OK, REFRESHED));
        clock.advanceSeconds(2);
        StepVerifier.create(tokenService.accessToken())
                .expectNext("access-2")
                .verifyComplete();
        assertThat(calls).containsExactly("/api/v2/token/new/", "/api/v2/token/refresh/");
    }

    @Test
    @DisplayName("Should exchange the stored refresh token for a new access token")
    void shouldRefreshWithStoredToken() {
        // Given
        storeConfig("id-1", "key-1", "refresh-0");
        responses.put("/token/refresh/", json(HttpStatus.OK, REFRESHED));

        // When / Then
        StepVerifier.create(tokenService.accessToken())
                .expectNext("access-2")
                .verifyComplete();

        assertThat(calls).containsExactly("/api/v2/token/refresh/");
        assertThat(configService.load().getToken()).isEqualTo("refresh-0");
    }

    @Test
    @DisplayName("Should fall back to a new pair when the refresh token is rejected")
    void shouldRequestNewPairWhenRefreshRejected() {
        // Given
        storeConfig("id-1", "key-1", "refresh-expired");
        responses.put("/token/refresh/", json(HttpStatus.UNAUTHORIZED, "{\"summary\": \"Invalid token\"}"));
        responses.put("/token/new/", json(HttpStatus.OK, NEW_PAIR));

        // When / Then
        StepVerifier.create(tokenService.accessToken())
                .expectNext("access-1")
                .verifyComplete();

        assertThat(calls).containsExactly("/api/v2/token/refresh/", "/api/v2/token/new/");
        assertThat(configService.load().getToken()).isEqualTo("refresh-1");
    }

    @Test
    @DisplayName("Should fail with missing credentials when the refresh token is rejected and no secrets are stored")
    void shouldFailWithoutCredentials() {
        storeConfig(null, null, "refresh-expired");
        responses.put("/token/refresh/", json(HttpStatus.UNAUTHORIZED, "{}"));

        StepVerifier.create(tokenService.accessToken())
                .expectError(MissingCredentialsException.class)
                .verify();
    }

    @Test
    @DisplayName("Should fail with missing credentials when nothing is configured")
    void shouldFailOnEmptyConfig() {
        StepVerifier.create(tokenService.accessToken())
                .expectError(MissingCredentialsException.class)
                .verify();

        assertThat(calls).isEmpty();
    }

    @Test
    @DisplayName("Should surface other token endpoint failures as transport errors")
    void shouldMapServerErrors() {
        storeConfig("id-1", "key-1", "refresh-0");
        responses.put("/token/refresh/", json(HttpStatus.INTERNAL_SERVER_ERROR, "{\"detail\": \"boom\"}"));

        StepVerifier.create(tokenService.accessToken())
                .expectErrorSatisfies(e -> {
                    assertThat(e).isInstanceOf(AggregatorTransportException.class);
                    assertThat(((AggregatorTransportException) e).getStatus()).isEqualTo(500);
                })
                .verify();
    }

    @Test
    @DisplayName("Should share one refresh between concurrent callers")
    void shouldShareConcurrentRefresh() {
        // Given
        storeConfig("id-1", "key-1", "refresh-0");
        responses.put("/token/refresh/", json(HttpStatus.OK, REFRESHED));
        latency = Duration.ofMillis(100);

        // When / Then
        StepVerifier.create(Flux.range(0, 6).flatMap(i -> tokenService.accessToken()).collectList())
                .assertNext(tokens -> assertThat(tokens).hasSize(6).containsOnly("access-2"))
                .verifyComplete();

        assertThat(calls).containsExactly("/api/v2/token/refresh/");
    }

    @Test
    @DisplayName("Should retry the refresh on the next call after a failed one")
    void shouldNotKeepFailedRefresh() {
        // Given
        storeConfig("id-1", "key-1", "refresh-0");
        responses.put("/token/refresh/", json(HttpStatus.SERVICE_UNAVAILABLE, "{}"));
        StepVerifier.create(tokenService.accessToken())
                .expectError(AggregatorTransportException.class)
                .verify();

        // When
        responses.put("/token/refresh/", json(HttpStatus.OK, REFRESHED));

        // Then
        StepVerifier.create(tokenService.accessToken())
                .expectNext("access-2")
                .verifyComplete();
        assertThat(calls).hasSize(2);
    }

    @Test
    @DisplayName("Should store explicitly supplied credentials with the new refresh token")
    void shouldPersistSuppliedCredentials() {
        responses.put("/token/new/", json(HttpStatus.OK, NEW_PAIR));

        StepVerifier.create(tokenService.newToken("id-new", "key-new"))
                .assertNext(pair -> {
                    assertThat(pair.accessExpires()).isEqualTo(86400);
                    assertThat(pair.refreshExpires()).isEqualTo(2592000L);
                })
                .verifyComplete();

        ImportConfig stored = configService.load();
        assertThat(stored.getSecretId()).isEqualTo("id-new");
        assertThat(stored.getSecretKey()).isEqualTo("key-new");
        assertThat(stored.getToken()).isEqualTo("refresh-1");
    }

    static final class MutableClock extends Clock {

        private Instant now;

        MutableClock(Instant start) {
            this.now = start;
        }

        void advanceSeconds(long seconds) {
            now = now.plusSeconds(seconds);
        }

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return now;
        }
    }
}
