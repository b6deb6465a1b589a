package com.adrelay.ingestion.adapter;

/**
 * Thrown when a ledger API call fails: network, HTTP status, timeout, local rate limit or unparsable payload.
 */
public class LedgerException extends RuntimeException {

    public LedgerException(String message) {
        super(message);
    }

    public LedgerException(String message, Throwable cause) {
        super(message, cause);
    }
}
