package com.storefront.backend.global.security;

import java.util.List;
import java.util.UUID;

public record JwtAuthenticationPrincipal(UUID userId, String email, List<String> roles, String deviceId) {
}
