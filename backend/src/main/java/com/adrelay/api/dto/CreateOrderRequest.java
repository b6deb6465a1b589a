package com.adrelay.api.dto;

import com.adrelay.api.validation.PayerAddress;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;

import java.util.List;

/**
 * POST /api/v1/orders request body. Duration range is checked by the pricing engine.
 */
public record CreateOrderRequest(
        @NotBlank(message = "INVALID_USER")
        String userId,

        @NotNull(message = "INVALID_DURATION")
        Integer durationDays,

        @NotEmpty(message = "INVALID_CHANNEL_COUNT")
        List<String> channelIds,

        @PayerAddress
        String payerAddress
) {
}
