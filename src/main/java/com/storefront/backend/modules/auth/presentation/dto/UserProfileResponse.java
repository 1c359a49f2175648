package com.storefront.backend.modules.auth.presentation.dto;

import java.time.OffsetDateTime;
import java.util.UUID;

public record UserProfileResponse(
        UUID userId,
        String email,
        String displayName,
        String role,
        String provider,
        boolean emailVerified,
        OffsetDateTime createdAt,
        OffsetDateTime updatedAt
) {
}
