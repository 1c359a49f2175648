package com.storefront.backend.modules.audit.domain;

public enum AuditAction {
    REGISTER_REQUEST,
    EMAIL_VERIFIED,
    EMAIL_SEND_FAILED,
    LOGIN_SUCCESS,
    LOGIN_FAILED,
    REFRESH,
    LOGOUT,
    TOKEN_REVOKED,
    PASSWORD_RESET_REQUEST,
    PASSWORD_RESET_COMPLETED,
    UPDATE_PROFILE,
    USER_DELETED
}
