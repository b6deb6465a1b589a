package com.adrelay.ingestion.adapter;

import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.ExchangeFunction;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class WebClientLedgerClientTest {

    private final AtomicReference<ClientRequest> lastRequest = new AtomicReference<>();

    @Test
    void getTransactions_buildsPagedRequestWithEncodedHash() {
        WebClientLedgerClient client = client(ok("{\"ok\":true,\"result\":[]}"), "secret");

        String body = client.getTransactions("https://toncenter.com/api/v2", "EQabc-_def", 50, 47000000000003L, "ab+/cd=")
                .block();

        assertThat(body).isEqualTo("{\"ok\":true,\"result\":[]}");
        ClientRequest request = lastRequest.get();
        assertThat(request.url().getPath()).isEqualTo("/api/v2/getTransactions");
        assertThat(request.url().getRawQuery())
                .contains("address=EQabc-_def")
                .contains("limit=50")
                .contains("archival=true")
                .contains("lt=47000000000003")
                .contains("hash=ab%2B%2Fcd%3D");
        assertThat(request.headers().getFirst("X-API-Key")).isEqualTo("secret");
    }

    @Test
    void getTransactions_firstPage_hasNoCursorAndNoKey() {
        WebClientLedgerClient client = client(ok("{\"ok\":true,\"result\":[]}"), null);

        client.getTransactions("https://toncenter.com/api/v2", "EQabc", 10, null, null).block();

        ClientRequest request = lastRequest.get();
        assertThat(request.url().getRawQuery()).doesNotContain("lt=").doesNotContain("hash=");
        assertThat(request.headers().containsKey("X-API-Key")).isFalse();
    }

    @Test
    void getTransactions_httpError_mapsToLedgerException() {
        WebClientLedgerClient client = client(req -> Mono.just(ClientResponse.create(HttpStatus.TOO_MANY_REQUESTS).build()), null);

        assertThatThrownBy(() -> client.getTransactions("https://toncenter.com/api/v2", "EQabc", 10, null, null).block())
                .isInstanceOf(LedgerException.class)
                .hasMessageContaining("HTTP 429");
    }

    @Test
    void getTransactions_slowResponse_mapsToLedgerException() {
        WebClientLedgerClient client = new WebClientLedgerClient(
                WebClient.builder().exchangeFunction(req -> Mono.never()), Duration.ofMillis(50), null);

        assertThatThrownBy(() -> client.getTransactions("https://toncenter.com/api/v2", "EQabc", 10, null, null).block())
                .isInstanceOf(LedgerException.class)
                .hasMessageContaining("Timeout");
    }

    private WebClientLedgerClient client(ExchangeFunction exchange,
                                         String apiKey) {
        return new WebClientLedgerClient(WebClient.builder().exchangeFunction(req -> {
            lastRequest.set(req);
            return exchange.exchange(req);
        }), Duration.ofSeconds(5), apiKey);
    }

    private static ExchangeFunction ok(String body) {
        return req -> Mono.just(ClientResponse.create(HttpStatus.OK)
                .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                .body(body)
                .build());
    }
}
