package com.storefront.backend.modules.auth.domain;

/**
 * How an account proves its identity. {@code GOOGLE} accounts may have no password digest.
 */
public enum AuthProvider {
    LOCAL,
    GOOGLE
}
