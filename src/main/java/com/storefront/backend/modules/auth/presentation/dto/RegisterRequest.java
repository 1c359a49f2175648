package com.storefront.backend.modules.auth.presentation.dto;

import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record RegisterRequest(
        @NotBlank(message = "email is required") @Email(message = "email must be valid") @Size(max = 320) String email,
        @NotBlank(message = "password is required") @Size(min = 5, max = 72, message = "password must be 5-72 characters") String password,
        @Size(max = 100, message = "displayName must be at most 100 characters") String displayName
) {
}
