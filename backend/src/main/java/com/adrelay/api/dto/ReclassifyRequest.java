package com.adrelay.api.dto;

import com.adrelay.domain.ReconciliationOutcome;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

/**
 * POST /api/v1/admin/transactions/{txId}/reclassify body. expectedOutcome guards against a concurrent change.
 */
public record ReclassifyRequest(
        @NotNull(message = "INVALID_OUTCOME")
        ReconciliationOutcome expectedOutcome,

        @NotNull(message = "INVALID_OUTCOME")
        ReconciliationOutcome newOutcome,

        @NotBlank(message = "INVALID_ACTOR")
        String actor,

        String reason
) {
}
