package com.storefront.backend.modules.auth.presentation;

import java.net.URI;

import com.storefront.backend.global.error.ProblemException;
import com.storefront.backend.global.security.SecurityUtils;
import com.storefront.backend.global.web.ClientMetadata;
import com.storefront.backend.modules.auth.application.LoginService;
import com.storefront.backend.modules.auth.application.PasswordResetService;
import com.storefront.backend.modules.auth.application.RefreshTokenService;
import com.storefront.backend.modules.auth.application.RegistrationService;
import com.storefront.backend.modules.auth.domain.SessionRevocationReason;
import com.storefront.backend.modules.auth.presentation.dto.LoginRequest;
import com.storefront.backend.modules.auth.presentation.dto.LogoutRequest;
import com.storefront.backend.modules.auth.presentation.dto.MessageResponse;
import com.storefront.backend.modules.auth.presentation.dto.PasswordResetRequest;
import com.storefront.backend.modules.auth.presentation.dto.RefreshRequest;
import com.storefront.backend.modules.auth.presentation.dto.RegisterRequest;
import com.storefront.backend.modules.auth.presentation.dto.ResetPasswordRequest;
import com.storefront.backend.modules.auth.presentation.dto.ResetTokenStatusResponse;
import com.storefront.backend.modules.auth.presentation.dto.TokenPairResponse;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.util.UriComponentsBuilder;

@RestController
@RequestMapping("/auth")
public class AuthController {

    private static final Logger log = LoggerFactory.getLogger(AuthController.class);

    static final String ALL_SESSIONS_REVOKED_MESSAGE = "All sessions have been revoked";

    private final RegistrationService registrationService;
    private final LoginService loginService;
    private final RefreshTokenService refreshTokenService;
    private final PasswordResetService passwordResetService;
    private final String frontendUrl;

    public AuthController(
            RegistrationService registrationService,
            LoginService loginService,
            RefreshTokenService refreshTokenService,
            PasswordResetService passwordResetService,
            @Value("${app.frontend.url:http://localhost:5173}") String frontendUrl
    ) {
        this.registrationService = registrationService;
        this.loginService = loginService;
        this.refreshTokenService = refreshTokenService;
        this.passwordResetService = passwordResetService;
        this.frontendUrl = frontendUrl;
    }

    @Operation(summary = "Register", description = "Stores a pending registration and mails a verification link.")
    @ApiResponses({
            @ApiResponse(responseCode = "201", description = "Verification mail sent"),
            @ApiResponse(responseCode = "409", description = "Email already registered"),
            @ApiResponse(responseCode = "422", description = "Invalid input")
    })
    @PostMapping("/register")
    public ResponseEntity<MessageResponse> register(@Valid @RequestBody RegisterRequest request,
                                                    HttpServletRequest httpRequest) {
        MessageResponse response = registrationService.register(request, ClientMetadata.from(httpRequest));
        return ResponseEntity.status(HttpStatus.CREATED).body(response);
    }

    @Operation(summary = "Verify email", description = "Redeems a verification link and redirects to the frontend.")
    @GetMapping("/verify-email")
    public ResponseEntity<Void> verifyEmail(@RequestParam(name = "token", required = false) String token) {
        String status;
        try {
            registrationService.verifyEmail(token);
            status = "success";
        } catch (ProblemException ex) {
            log.info("Email verification failed: {}", ex.getCode());
            status = "failed";
        }
        URI location = UriComponentsBuilder.fromUriString(frontendUrl)
                .path("/email-verified")
                .queryParam("status", status)
                .build()
                .toUri();
        return ResponseEntity.status(HttpStatus.FOUND).location(location).build();
    }

    @Operation(summary = "Login", description = "Issues an access/refresh token pair bound to the given device.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Signed in"),
            @ApiResponse(responseCode = "401", description = "Invalid credentials")
    })
    @PostMapping("/login")
    public ResponseEntity<TokenPairResponse> login(@Valid @RequestBody LoginRequest request,
                                                   HttpServletRequest httpRequest) {
        return ResponseEntity.ok(loginService.login(request, ClientMetadata.from(httpRequest)));
    }

    @Operation(summary = "Refresh", description = "Rotates a refresh token. The presented token cannot be used again.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Rotated"),
            @ApiResponse(responseCode = "401", description = "Invalid, expired or already used refresh token"),
            @ApiResponse(responseCode = "429", description = "Refreshed too soon, see Retry-After")
    })
    @PostMapping("/refresh")
    public ResponseEntity<TokenPairResponse> refresh(@Valid @RequestBody RefreshRequest request,
                                                     HttpServletRequest httpRequest) {
        return ResponseEntity.ok(refreshTokenService.refresh(request, ClientMetadata.from(httpRequest)));
    }

    @Operation(summary = "Logout", description = "Revokes one refresh token.")
    @PostMapping("/logout")
    public ResponseEntity<MessageResponse> logout(@Valid @RequestBody LogoutRequest request,
                                                  HttpServletRequest httpRequest) {
        return ResponseEntity.ok(refreshTokenService.logout(request, ClientMetadata.from(httpRequest)));
    }

    @Operation(summary = "Logout everywhere", description = "Revokes every session of the signed-in user.")
    @PostMapping("/logout-all")
    public ResponseEntity<MessageResponse> logoutAll() {
        refreshTokenService.logoutAll(SecurityUtils.getCurrentUserId(), SessionRevocationReason.LOGOUT_ALL);
        return ResponseEntity.ok(new MessageResponse(ALL_SESSIONS_REVOKED_MESSAGE));
    }

    @Operation(summary = "Request password reset", description = "Always answers with the same message.")
    @PostMapping("/request-password-reset")
    public ResponseEntity<MessageResponse> requestPasswordReset(@Valid @RequestBody PasswordResetRequest request,
                                                                HttpServletRequest httpRequest) {
        return ResponseEntity.ok(passwordResetService.requestReset(request, ClientMetadata.from(httpRequest)));
    }

    @Operation(summary = "Open reset link", description = "Checks a reset link and redirects to the reset page.")
    @GetMapping("/verify-reset")
    public ResponseEntity<Void> verifyReset(@RequestParam(name = "token", required = false) String token) {
        UriComponentsBuilder builder = UriComponentsBuilder.fromUriString(frontendUrl).path("/reset-password");
        try {
            passwordResetService.verifyResetToken(token);
            builder.queryParam("token", token.trim()).queryParam("status", "valid");
        } catch (ProblemException ex) {
            log.debug("Reset link rejected: {}", ex.getCode());
            builder.queryParam("status", "invalid");
        }
        return ResponseEntity.status(HttpStatus.FOUND).location(builder.build().toUri()).build();
    }

    @Operation(summary = "Reset link status", description = "Reports whether a reset link can still be redeemed.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Link is valid"),
            @ApiResponse(responseCode = "401", description = "Invalid, expired or used reset token")
    })
    @GetMapping("/reset-token-status")
    public ResponseEntity<ResetTokenStatusResponse> resetTokenStatus(
            @RequestParam(name = "token", required = false) String token) {
        return ResponseEntity.ok(passwordResetService.verifyResetToken(token));
    }

    @Operation(summary = "Reset password", description = "Redeems a reset token, sets the new password and signs out every device.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Password changed"),
            @ApiResponse(responseCode = "401", description = "Invalid, expired or used reset token")
    })
    @PostMapping("/reset-password")
    public ResponseEntity<MessageResponse> resetPassword(@Valid @RequestBody ResetPasswordRequest request) {
        return ResponseEntity.ok(passwordResetService.resetPassword(request));
    }
}
