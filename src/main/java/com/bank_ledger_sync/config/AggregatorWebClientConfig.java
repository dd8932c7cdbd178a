package com.bank_ledger_sync.config;

import java.time.Clock;
import java.time.Duration;
import io.netty.channel.ChannelOption;
import reactor.netty.http.client.HttpClient;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.MediaType;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.ExchangeStrategies;
import org.springframework.web.reactive.function.client.WebClient;

@Configuration
@EnableConfigurationProperties({AggregatorProperties.class, ReconcileProperties.class})
public class AggregatorWebClientConfig {

    @Bean
    @Qualifier("aggregatorWebClient")
    public WebClient aggregatorWebClient(AggregatorProperties props) {
        // relative URIs ("accounts/{id}/balances/") resolve against this, so keep the trailing slash
        String baseUrl = props.getBaseUrl().endsWith("/") ? props.getBaseUrl() : props.getBaseUrl() + "/";

        HttpClient httpClient = HttpClient.create()
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, props.getConnectTimeoutMillis())
                .responseTimeout(Duration.ofMillis(props.getResponseTimeoutMillis()));

        ExchangeStrategies strategies = ExchangeStrategies.builder()
                .codecs(cfg -> cfg.defaultCodecs().maxInMemorySize(16 * 1024 * 1024)) // 16 MB, transaction lists can be long
                .build();

        return WebClient.builder()
                .baseUrl(baseUrl)
                .clientConnector(new ReactorClientHttpConnector(httpClient))
                .exchangeStrategies(strategies)
                .defaultHeader("Accept", MediaType.APPLICATION_JSON_VALUE)
                .defaultHeader("Content-Type", MediaType.APPLICATION_JSON_VALUE)
                .build();
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
