package com.adrelay.api.dto;

import jakarta.validation.constraints.NotBlank;

public record PostFailureRequest(
        @NotBlank(message = "INVALID_REASON")
        String reason
) {
}
