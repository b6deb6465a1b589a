package com.adrelay.admin;

import lombok.Getter;

/**
 * Rejected administrative correction. API layer maps TRANSACTION_NOT_FOUND and ORDER_NOT_FOUND to 404,
 * INVALID_STATE to 409, INVALID_OUTCOME to 400.
 */
@Getter
public class AdminActionException extends RuntimeException {

    public static final String TRANSACTION_NOT_FOUND = "TRANSACTION_NOT_FOUND";
    public static final String ORDER_NOT_FOUND = "ORDER_NOT_FOUND";
    public static final String INVALID_STATE = "INVALID_STATE";
    public static final String INVALID_OUTCOME = "INVALID_OUTCOME";

    private final String errorCode;

    public AdminActionException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }
}
