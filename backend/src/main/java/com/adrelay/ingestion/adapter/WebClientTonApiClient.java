package com.adrelay.ingestion.adapter;

import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import org.springframework.web.util.UriComponentsBuilder;
import reactor.core.publisher.Mono;

import java.net.URI;
import java.time.Duration;
import java.util.concurrent.TimeoutException;

/**
 * TonApiClient over WebClient. Used by TonApiTransferSource.
 */
public class WebClientTonApiClient implements TonApiClient {

    private final WebClient webClient;
    private final Duration timeout;
    private final String apiKey;

    public WebClientTonApiClient(WebClient.Builder builder, Duration timeout, String apiKey) {
        this.webClient = builder.build();
        this.timeout = timeout;
        this.apiKey = apiKey;
    }

    @Override
    public Mono<String> getAccountTransactions(String endpoint, String account, int limit, Long beforeLt) {
        UriComponentsBuilder uri = UriComponentsBuilder.fromHttpUrl(endpoint)
                .path("/blockchain/accounts/{account}/transactions")
                .queryParam("limit", limit);
        if (beforeLt != null) {
            uri.queryParam("before_lt", beforeLt);
        }
        URI target = uri.encode().buildAndExpand(account).toUri();
        return webClient.get()
                .uri(target)
                .accept(MediaType.APPLICATION_JSON)
                .headers(h -> {
                    if (apiKey != null && !apiKey.isBlank()) {
                        h.setBearerAuth(apiKey);
                    }
                })
                .retrieve()
                .bodyToMono(String.class)
                .timeout(timeout)
                .onErrorMap(WebClientResponseException.class,
                        e -> new LedgerException("HTTP " + e.getStatusCode().value() + " from " + endpoint, e))
                .onErrorMap(WebClientRequestException.class,
                        e -> new LedgerException("Request to " + endpoint + " failed: " + e.getMessage(), e))
                .onErrorMap(TimeoutException.class,
                        e -> new LedgerException("Timeout after " + timeout.toMillis() + " ms on " + endpoint, e));
    }
}
