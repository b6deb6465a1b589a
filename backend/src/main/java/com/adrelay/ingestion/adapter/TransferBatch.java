package com.adrelay.ingestion.adapter;

import java.time.Instant;
import java.util.List;

/**
 * Result of one bounded history read.
 *
 * @param transfers    incoming transfers read, ascending by (timestamp, logicalTime), each txId once
 * @param complete     true when the read reached the requested start time or the beginning of the history
 * @param resumeAfter  oldest transaction read when the page limit stopped the read; null when complete
 * @param newestReadAt ledger timestamp of the newest transaction read (transfer or not); null when nothing was read
 */
public record TransferBatch(List<LedgerTransfer> transfers, boolean complete, LedgerPosition resumeAfter,
                            Instant newestReadAt) {

    public TransferBatch {
        transfers = List.copyOf(transfers);
    }

    public static TransferBatch complete(List<LedgerTransfer> transfers, Instant newestReadAt) {
        return new TransferBatch(transfers, true, null, newestReadAt);
    }
}
