package com.storefront.backend.modules.auth.domain;

public enum UserRole {
    CUSTOMER,
    ADMIN
}
