package com.bank_ledger_sync.service;

import com.bank_ledger_sync.aggregator.dto.TokenPairResponse;
import com.bank_ledger_sync.config.AggregatorProperties;
import com.bank_ledger_sync.exception.AggregatorTransportException;
import com.bank_ledger_sync.exception.MissingCredentialsException;
import com.bank_ledger_sync.model.ImportConfig;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Clock;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;

@Service
@Slf4j
@RequiredArgsConstructor
public class TokenService {

    @Qualifier("aggregatorWebClient")
    private final WebClient aggregatorClient;
    private final ConfigService configService;
    private final AggregatorProperties props;
    private final Clock clock;

    private volatile CachedToken cached;
    private final AtomicReference<Mono<CachedToken>> inFlight = new AtomicReference<>();

    private record CachedToken(String access, Instant expiresAt) {}

    public Mono<String> accessToken() {
        CachedToken current = cached;
        if (current != null && clock.instant().isBefore(current.expiresAt())) {
            return Mono.just(current.access());
        }
        return Mono.defer(this::sharedRefresh).map(CachedToken::access);
    }

    // concurrent callers join the refresh already running; it is dropped once it ends so a failure is retried
    private Mono<CachedToken> sharedRefresh() {
        Mono<CachedToken> existing = inFlight.get();
        if (existing != null) {
            return existing;
        }
        Mono<CachedToken> refresh = Mono.fromCallable(configService::load)
                .subscribeOn(Schedulers.boundedElastic())
                .flatMap(this::refresh)
                .doOnTerminate(() -> inFlight.set(null))
                .cache();
        return inFlight.compareAndSet(null, refresh) ? refresh : sharedRefresh();
    }

    // blank arguments fall back to the stored credentials
    public Mono<TokenPairResponse> newToken(String secretId, String secretKey) {
        return Mono.fromCallable(configService::load)
                .subscribeOn(Schedulers.boundedElastic())
                .flatMap(config -> {
                    String id = isBlank(secretId) ? config.getSecretId() : secretId;
                    String key = isBlank(secretKey) ? config.getSecretKey() : secretKey;
                    if (isBlank(id) || isBlank(key)) {
                        return Mono.error(new MissingCredentialsException("No aggregator secret id/key configured"));
                    }
                    return requestNewPair(id, key);
                });
    }

    private Mono<CachedToken> refresh(ImportConfig config) {
        if (isBlank(config.getToken())) {
            log.info("No refresh token stored, requesting a new token pair");
            return newToken(null, null).map(this::remember);
        }

        return aggregatorClient.post()
                .uri("token/refresh/")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(Map.of("refresh", config.getToken()))
                .retrieve()
                .bodyToMono(TokenPairResponse.class)
                .map(this::remember)
                .onErrorResume(WebClientResponseException.Unauthorized.class, ex -> {
                    log.info("Refresh token rejected, requesting a new token pair");
                    if (!config.hasCredentials()) {
                        return Mono.error(new MissingCredentialsException(
                                "Refresh token expired and no secret id/key configured"));
                    }
                    return requestNewPair(config.getSecretId(), config.getSecretKey()).map(this::remember);
                })
                .onErrorMap(WebClientResponseException.class, ex -> new AggregatorTransportException(
                        "Token refresh failed", ex.getStatusCode().value(), ex.getResponseBodyAsString()))
                .onErrorMap(WebClientRequestException.class,
                        ex -> new AggregatorTransportException("Token refresh failed", ex));
    }

    private Mono<TokenPairResponse> requestNewPair(String secretId, String secretKey) {
        return aggregatorClient.post()
                .uri("token/new/")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(Map.of("secret_id", secretId, "secret_key", secretKey))
                .retrieve()
                .bodyToMono(TokenPairResponse.class)
                .onErrorMap(WebClientResponseException.class, ex -> new AggregatorTransportException(
                        "Token request failed", ex.getStatusCode().value(), ex.getResponseBodyAsString()))
                .onErrorMap(WebClientRequestException.class,
                        ex -> new AggregatorTransportException("Token request failed", ex))
                .flatMap(pair -> Mono.fromCallable(() -> configService.update(config -> config.toBuilder()
                                .secretId(secretId)
                                .secretKey(secretKey)
                                .token(pair.refresh())
                                .build()))
                        .subscribeOn(Schedulers.boundedElastic())
                        .thenReturn(pair))
                .doOnNext(pair -> {
                    remember(pair);
                    log.info("Obtained new aggregator token pair, access valid for {}s", pair.accessExpires());
                });
    }

    private CachedToken remember(TokenPairResponse pair) {
        Instant expiresAt = clock.instant()
                .plusSeconds(pair.accessExpires())
                .minusSeconds(props.getTokenExpirySkewSeconds());
        CachedToken token = new CachedToken(pair.access(), expiresAt);
        cached = token;
        return token;
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
