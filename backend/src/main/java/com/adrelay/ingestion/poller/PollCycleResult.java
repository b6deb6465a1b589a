package com.adrelay.ingestion.poller;

/**
 * Outcome of one poll cycle for one receiving address.
 */
public record PollCycleResult(String receivingAddress, Status status, int fetched, int handedOff, int inserted) {

    public enum Status {
        COMPLETED,
        /** Read and handed off, but the window was not read back to its start; continues next cycle. */
        PARTIAL,
        /** Skipped: the address is inside its failure backoff window. */
        BACKING_OFF,
        FAILED
    }

    static PollCycleResult backingOff(String receivingAddress) {
        return new PollCycleResult(receivingAddress, Status.BACKING_OFF, 0, 0, 0);
    }
}
