package com.adrelay.ingestion.adapter;

/**
 * A transaction of the receiving address, identified by logical time and base64 hash.
 */
public record LedgerPosition(long logicalTime, String hash) {

    public boolean matches(long otherLogicalTime, String otherHash) {
        return logicalTime == otherLogicalTime && hash.equals(otherHash);
    }
}
