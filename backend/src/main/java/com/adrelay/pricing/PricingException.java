package com.adrelay.pricing;

import lombok.Getter;

/**
 * Rejected pricing input. API layer maps it to 400.
 */
@Getter
public class PricingException extends RuntimeException {

    public static final String INVALID_DURATION = "INVALID_DURATION";
    public static final String INVALID_CHANNEL_COUNT = "INVALID_CHANNEL_COUNT";

    /** INVALID_DURATION or INVALID_CHANNEL_COUNT. */
    private final String errorCode;

    public PricingException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }
}
