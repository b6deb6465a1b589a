package com.adrelay.api.dto;

import jakarta.validation.constraints.NotBlank;

/**
 * POST /api/v1/admin/transactions/{txId}/force-match body.
 */
public record ForceMatchRequest(
        @NotBlank(message = "INVALID_ORDER")
        String orderId,

        @NotBlank(message = "INVALID_ACTOR")
        String actor,

        String reason
) {
}
