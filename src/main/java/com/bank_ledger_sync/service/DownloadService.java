package com.bank_ledger_sync.service;

import com.bank_ledger_sync.aggregator.AggregatorClient;
import com.bank_ledger_sync.aggregator.dto.AgreementErrorResponse;
import com.bank_ledger_sync.aggregator.dto.AggregatorBalancesResponse;
import com.bank_ledger_sync.aggregator.dto.AggregatorTransactionsResponse;
import com.bank_ledger_sync.aggregator.dto.AggregatorTransactionsResponse.TransactionsGroup;
import com.bank_ledger_sync.aggregator.dto.ReconfirmationResponse;
import com.bank_ledger_sync.config.AggregatorProperties;
import com.bank_ledger_sync.exception.AggregatorTransportException;
import com.bank_ledger_sync.exception.NoBalanceAvailableException;
import com.bank_ledger_sync.exception.ReconfirmationRequiredException;
import com.bank_ledger_sync.model.AccountDownload;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

// the first failing account fails the whole download and cancels the requests still in flight
@Service
@Slf4j
@RequiredArgsConstructor
public class DownloadService {

    // most authoritative first
    static final List<String> BALANCE_PRIORITY = List.of(
            "expectedClosed",
            "interimBooked",
            "closingBooked",
            "openingBooked",
            "information",
            "interimAvailable",
            "closingAvailable",
            "openingAvailable"
    );

    private static final Pattern UUID_RE =
            Pattern.compile("[0-9a-f]{8}-[0-9a-f]{4}-[0-9a-f]{4}-[0-9a-f]{4}-[0-9a-f]{12}");

    private final AggregatorClient client;
    private final AggregatorProperties props;
    private final ObjectMapper objectMapper;

    public Mono<Map<String, AccountDownload>> fetchAll(Collection<String> accountIds) {
        return Flux.fromIterable(new LinkedHashSet<>(accountIds))
                .flatMap(this::fetchAccount, props.getMaxConcurrency())
                .collectMap(AccountDownload::accountId, Function.identity(), LinkedHashMap::new)
                .doOnNext(downloads -> log.info("Downloaded {} accounts", downloads.size()));
    }

    public Mono<AccountDownload> fetchAccount(String accountId) {
        Mono<AggregatorBalancesResponse.Balance> balance = client
                .get("accounts/{id}/balances/", AggregatorBalancesResponse.class, accountId)
                .onErrorResume(AggregatorTransportException.class, ex -> agreementExpired(accountId, ex))
                .map(res -> selectBalance(accountId, res));

        Mono<TransactionsGroup> transactions = client
                .get("accounts/{id}/transactions/", AggregatorTransactionsResponse.class, accountId)
                .map(res -> Optional.ofNullable(res.transactions())
                        .orElseGet(() -> new TransactionsGroup(List.of(), List.of())));

        return Mono.zip(balance, transactions)
                .map(tuple -> AccountDownload.builder()
                        .accountId(accountId)
                        .balance(tuple.getT1().balanceAmount().amount())
                        .balanceType(tuple.getT1().balanceType())
                        .transactions(tuple.getT2())
                        .build())
                .doOnNext(d -> log.debug("Account {}: balance {} ({}), {} booked, {} pending",
                        accountId, d.balance(), d.balanceType(),
                        d.transactions().booked().size(), d.transactions().pending().size()));
    }

    static AggregatorBalancesResponse.Balance selectBalance(String accountId, AggregatorBalancesResponse response) {
        Map<String, AggregatorBalancesResponse.Balance> byType = Optional.ofNullable(response.balances())
                .orElse(List.of())
                .stream()
                .filter(b -> b.balanceType() != null && b.balanceAmount() != null && b.balanceAmount().amount() != null)
                .collect(Collectors.toMap(AggregatorBalancesResponse.Balance::balanceType, Function.identity(),
                        (first, second) -> first, LinkedHashMap::new));

        return BALANCE_PRIORITY.stream()
                .filter(byType::containsKey)
                .findFirst()
                .map(byType::get)
                .orElseThrow(() -> new NoBalanceAvailableException(accountId, byType.keySet()));
    }

    // A 401 naming an end user agreement means the bank consent lapsed; ask for a reconfirmation link.
    private Mono<AggregatorBalancesResponse> agreementExpired(String accountId, AggregatorTransportException ex) {
        if (ex.getStatus() != 401) {
            return Mono.error(ex);
        }
        Optional<String> agreementId = agreementId(ex.getResponseBody());
        if (agreementId.isEmpty()) {
            return Mono.error(ex);
        }
        log.warn("Agreement {} for account {} has expired, requesting reconfirmation", agreementId.get(), accountId);
        return client.post("agreements/enduser/{id}/reconfirm/", null, ReconfirmationResponse.class, agreementId.get())
                .flatMap(res -> Mono.<AggregatorBalancesResponse>error(
                        new ReconfirmationRequiredException(accountId, agreementId.get(), res.reconfirmationUrl())))
                .switchIfEmpty(Mono.error(ex));
    }

    private Optional<String> agreementId(String body) {
        if (body == null || body.isBlank()) return Optional.empty();
        try {
            AgreementErrorResponse error = objectMapper.readValue(body, AgreementErrorResponse.class);
            if (error.summary() == null) return Optional.empty();
            Matcher m = UUID_RE.matcher(error.summary());
            return m.find() ? Optional.of(m.group()) : Optional.empty();
        } catch (JsonProcessingException e) {
            log.debug("401 body is not JSON: {}", body);
            return Optional.empty();
        }
    }
}
