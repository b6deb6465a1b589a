package com.adrelay.api.dto;

import jakarta.validation.constraints.NotBlank;

public record ProvisionRequest(
        @NotBlank(message = "INVALID_ACTOR")
        String actor
) {
}
