package com.adrelay.campaign;

import lombok.Getter;

/**
 * Thrown when an order cannot be provisioned. API layer maps ORDER_NOT_MATCHED to 409.
 */
@Getter
public class CampaignProvisioningException extends RuntimeException {

    public static final String ORDER_NOT_MATCHED = "ORDER_NOT_MATCHED";

    private final String errorCode;

    public CampaignProvisioningException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }
}
