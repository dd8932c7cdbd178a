package com.bank_ledger_sync.aggregator;

import com.bank_ledger_sync.exception.AggregatorTransportException;
import com.bank_ledger_sync.service.TokenService;
import lombok.RequiredArgsConstructor;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;

// uris are relative to the aggregator base url, e.g. "accounts/{id}/balances/"
@Component
@RequiredArgsConstructor
public class AggregatorClient {

    @Qualifier("aggregatorWebClient")
    private final WebClient aggregatorClient;
    private final TokenService tokenService;

    public <T> Mono<T> get(String uri, Class<T> type, Object... uriVariables) {
        return tokenService.accessToken()
                .flatMap(token -> transportErrors("GET " + uri, aggregatorClient.get()
                        .uri(uri, uriVariables)
                        .headers(h -> h.setBearerAuth(token))
                        .accept(MediaType.APPLICATION_JSON)
                        .retrieve()
                        .bodyToMono(type)));
    }

    public <T> Mono<T> post(String uri, Object body, Class<T> type, Object... uriVariables) {
        return tokenService.accessToken()
                .flatMap(token -> {
                    WebClient.RequestBodySpec request = aggregatorClient.post()
                            .uri(uri, uriVariables)
                            .headers(h -> h.setBearerAuth(token))
                            .contentType(MediaType.APPLICATION_JSON)
                            .accept(MediaType.APPLICATION_JSON);
                    // some endpoints (agreement reconfirm) take no body at all
                    WebClient.RequestHeadersSpec<?> spec = body == null ? request : request.bodyValue(body);
                    return transportErrors("POST " + uri, spec.retrieve().bodyToMono(type));
                });
    }

    // token errors stay as they are, everything raised by the exchange itself becomes a transport error
    private static <T> Mono<T> transportErrors(String call, Mono<T> exchange) {
        return exchange
                .onErrorMap(WebClientResponseException.class, ex -> new AggregatorTransportException(
                        call, ex.getStatusCode().value(), ex.getResponseBodyAsString()))
                .onErrorMap(ex -> !(ex instanceof AggregatorTransportException),
                        ex -> new AggregatorTransportException(call + " failed", ex));
    }
}
