package com.adrelay.order;

import lombok.Getter;

/**
 * Thrown by OrderLedgerService. API layer maps ORDER_NOT_FOUND to 404, ORDER_NOT_CANCELLABLE to 409,
 * REFERENCE_CODE_EXHAUSTED and NO_RECEIVING_ADDRESS to 503.
 */
@Getter
public class OrderLedgerException extends RuntimeException {

    public static final String ORDER_NOT_FOUND = "ORDER_NOT_FOUND";
    public static final String ORDER_NOT_CANCELLABLE = "ORDER_NOT_CANCELLABLE";
    public static final String REFERENCE_CODE_EXHAUSTED = "REFERENCE_CODE_EXHAUSTED";
    public static final String NO_RECEIVING_ADDRESS = "NO_RECEIVING_ADDRESS";

    private final String errorCode;

    public OrderLedgerException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }
}
