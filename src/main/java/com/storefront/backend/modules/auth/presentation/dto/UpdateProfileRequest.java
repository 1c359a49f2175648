package com.storefront.backend.modules.auth.presentation.dto;

import jakarta.validation.constraints.Size;

/**
 * Partial update of the signed-in account. Null fields are left untouched; a new password
 * needs the current one.
 */
public record UpdateProfileRequest(
        @Size(max = 100, message = "displayName must be at most 100 characters") String displayName,
        String currentPassword,
        @Size(min = 5, max = 72, message = "newPassword must be 5-72 characters") String newPassword
) {
}
