package com.adrelay.ingestion.adapter;

import java.time.Instant;

/**
 * Reads incoming transfers of a receiving address from the external ledger, newest first, at most a bounded
 * number of pages per call.
 */
public interface TransferSource {

    /**
     * Incoming transfers with timestamp >= since. Starts at the newest transaction, or strictly before
     * startAfter when given. When the page limit stops the read before since, the batch is incomplete and
     * names the oldest transaction read so the next call can continue from it.
     *
     * @throws LedgerException when the ledger could not be read after retries or returned a malformed entry
     */
    TransferBatch fetchSince(String receivingAddress, Instant since, LedgerPosition startAfter);
}
