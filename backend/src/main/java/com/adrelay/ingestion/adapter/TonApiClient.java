package com.adrelay.ingestion.adapter;

import reactor.core.publisher.Mono;

/**
 * Raw access to the tonapi.io v2 blockchain API.
 */
public interface TonApiClient {

    /**
     * GET {endpoint}/blockchain/accounts/{account}/transactions, newest first. beforeLt, when set, returns only
     * transactions with a smaller logical time. Emits the response body or fails with {@link LedgerException}.
     */
    Mono<String> getAccountTransactions(String endpoint, String account, int limit, Long beforeLt);
}
