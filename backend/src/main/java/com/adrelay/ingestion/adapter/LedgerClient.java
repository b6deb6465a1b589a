package com.adrelay.ingestion.adapter;

import reactor.core.publisher.Mono;

/**
 * Raw access to a TON Center v2 compatible HTTP API.
 */
public interface LedgerClient {

    /**
     * GET {endpoint}/getTransactions for the address, newest first. lt and hash, when both set, start the page
     * at that transaction (inclusive). Emits the response body or fails with {@link LedgerException}.
     */
    Mono<String> getTransactions(String endpoint, String address, int limit, Long lt, String hash);
}
