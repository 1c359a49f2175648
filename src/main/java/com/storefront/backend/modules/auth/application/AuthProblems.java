package com.storefront.backend.modules.auth.application;

import com.storefront.backend.global.error.ProblemException;
import com.storefront.backend.global.error.RetryableProblemException;

import org.springframework.http.HttpStatus;

/**
 * Error vocabulary of the auth flows. Credential failures share one code and message so
 * callers cannot tell a missing account from a wrong password.
 */
public final class AuthProblems {

    public static final String EMAIL_ALREADY_REGISTERED = "EMAIL_ALREADY_REGISTERED";
    public static final String INVALID_OR_EXPIRED_TOKEN = "INVALID_OR_EXPIRED_TOKEN";
    public static final String INVALID_CREDENTIALS = "INVALID_CREDENTIALS";
    public static final String INVALID_REFRESH_TOKEN = "INVALID_REFRESH_TOKEN";
    public static final String REFRESH_TOO_SOON = "REFRESH_TOO_SOON";
    public static final String REFRESH_TOKEN_NOT_FOUND = "REFRESH_TOKEN_NOT_FOUND";
    public static final String INVALID_RESET_TOKEN = "INVALID_RESET_TOKEN";
    public static final String MAIL_DISPATCH_FAILED = "MAIL_DISPATCH_FAILED";
    public static final String USER_NOT_FOUND = "USER_NOT_FOUND";
    public static final String ADMIN_DELETION_FORBIDDEN = "ADMIN_DELETION_FORBIDDEN";
    public static final String CURRENT_PASSWORD_REQUIRED = "CURRENT_PASSWORD_REQUIRED";
    public static final String CURRENT_PASSWORD_INCORRECT = "CURRENT_PASSWORD_INCORRECT";

    private AuthProblems() {
    }

    public static ProblemException emailAlreadyRegistered() {
        return new ProblemException(HttpStatus.CONFLICT, EMAIL_ALREADY_REGISTERED, "Email already in use");
    }

    public static ProblemException invalidOrExpiredToken() {
        return new ProblemException(HttpStatus.BAD_REQUEST, INVALID_OR_EXPIRED_TOKEN, "Invalid or expired token");
    }

    public static ProblemException invalidCredentials() {
        return new ProblemException(HttpStatus.UNAUTHORIZED, INVALID_CREDENTIALS, "Invalid credentials");
    }

    public static ProblemException invalidRefreshToken() {
        return new ProblemException(HttpStatus.UNAUTHORIZED, INVALID_REFRESH_TOKEN, "Invalid or revoked refresh token");
    }

    public static RetryableProblemException refreshTooSoon(long retryAfterSeconds) {
        return new RetryableProblemException(HttpStatus.TOO_MANY_REQUESTS, REFRESH_TOO_SOON,
                "Refresh requested too soon", retryAfterSeconds);
    }

    public static ProblemException refreshTokenNotFound() {
        return new ProblemException(HttpStatus.NOT_FOUND, REFRESH_TOKEN_NOT_FOUND, "Refresh token not found");
    }

    public static ProblemException invalidResetToken() {
        return new ProblemException(HttpStatus.UNAUTHORIZED, INVALID_RESET_TOKEN,
                "This reset link is invalid, expired or has already been used.");
    }

    public static ProblemException mailDispatchFailed(Throwable cause) {
        return new ProblemException(HttpStatus.INTERNAL_SERVER_ERROR, MAIL_DISPATCH_FAILED,
                "Failed to send verification email. Please try again later.", cause);
    }

    public static ProblemException userNotFound() {
        return new ProblemException(HttpStatus.NOT_FOUND, USER_NOT_FOUND, "User not found");
    }

    public static ProblemException adminDeletionForbidden() {
        return new ProblemException(HttpStatus.FORBIDDEN, ADMIN_DELETION_FORBIDDEN, "Admins cannot delete their account");
    }

    public static ProblemException currentPasswordRequired() {
        return new ProblemException(HttpStatus.BAD_REQUEST, CURRENT_PASSWORD_REQUIRED, "Current password is required");
    }

    public static ProblemException currentPasswordIncorrect() {
        return new ProblemException(HttpStatus.BAD_REQUEST, CURRENT_PASSWORD_INCORRECT, "Current password is incorrect");
    }
}
