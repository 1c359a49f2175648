package com.storefront.backend.modules.auth.presentation.dto;

/**
 * Confirmation that a reset link can still be redeemed. {@code email} is masked.
 */
public record ResetTokenStatusResponse(boolean valid, String email) {
}
