package com.storefront.backend.modules.auth.domain;

public enum SessionRevocationReason {
    ROTATED,
    LOGOUT,
    LOGOUT_ALL,
    PASSWORD_RESET,
    PASSWORD_CHANGED,
    ACCOUNT_DELETED
}
