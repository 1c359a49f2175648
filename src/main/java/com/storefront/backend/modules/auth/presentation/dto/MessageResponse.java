package com.storefront.backend.modules.auth.presentation.dto;

public record MessageResponse(String message) {
}
