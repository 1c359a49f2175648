package com.storefront.backend.modules.auth.presentation.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record LoginRequest(
        @NotBlank(message = "email is required") String email,
        @NotBlank(message = "password is required") String password,
        @NotBlank(message = "deviceId is required") @Size(max = 100) String deviceId,
        @Size(max = 100) String deviceName
) {
}
