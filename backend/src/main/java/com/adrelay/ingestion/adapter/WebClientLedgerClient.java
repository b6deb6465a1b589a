package com.adrelay.ingestion.adapter;

import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import org.springframework.web.util.UriComponentsBuilder;
import reactor.core.publisher.Mono;

import java.net.URI;
import java.time.Duration;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.TimeoutException;

/**
 * LedgerClient over WebClient. Used by TonCenterTransferSource.
 */
public class WebClientLedgerClient implements LedgerClient {

    private final WebClient webClient;
    private final Duration timeout;
    private final String apiKey;

    public WebClientLedgerClient(WebClient.Builder builder, Duration timeout, String apiKey) {
        this.webClient = builder.build();
        this.timeout = timeout;
        this.apiKey = apiKey;
    }

    @Override
    public Mono<String> getTransactions(String endpoint, String address, int limit, Long lt, String hash) {
        UriComponentsBuilder uri = UriComponentsBuilder.fromHttpUrl(endpoint)
                .path("/getTransactions")
                .queryParam("address", "{address}")
                .queryParam("limit", limit)
                .queryParam("archival", true);
        Map<String, Object> variables = new HashMap<>();
        variables.put("address", address);
        if (lt != null && hash != null) {
            // base64 hashes carry '+', '/' and '=': pass as variables so they are fully encoded
            uri.queryParam("lt", lt).queryParam("hash", "{hash}");
            variables.put("hash", hash);
        }
        URI target = uri.encode().buildAndExpand(variables).toUri();
        return webClient.get()
                .uri(target)
                .headers(h -> {
                    if (apiKey != null && !apiKey.isBlank()) {
                        h.set("X-API-Key", apiKey);
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
