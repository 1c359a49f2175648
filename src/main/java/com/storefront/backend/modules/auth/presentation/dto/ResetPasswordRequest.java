package com.storefront.backend.modules.auth.presentation.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record ResetPasswordRequest(
        @NotBlank(message = "token is required") String token,
        @NotBlank(message = "newPassword is required") @Size(min = 5, max = 72, message = "newPassword must be 5-72 characters") String newPassword
) {
}
