package com.storefront.backend.modules.auth.application;

import java.time.Clock;
import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.Map;
import java.util.UUID;

import com.storefront.backend.global.web.ClientMetadata;
import com.storefront.backend.modules.audit.application.AuditTrail;
import com.storefront.backend.modules.audit.domain.AuditAction;
import com.storefront.backend.modules.auth.domain.AppUser;
import com.storefront.backend.modules.auth.domain.RefreshToken;
import com.storefront.backend.modules.auth.domain.SessionRevocationReason;
import com.storefront.backend.modules.auth.infrastructure.persistence.RefreshTokenRepository;
import com.storefront.backend.modules.auth.presentation.dto.LogoutRequest;
import com.storefront.backend.modules.auth.presentation.dto.MessageResponse;
import com.storefront.backend.modules.auth.presentation.dto.RefreshRequest;
import com.storefront.backend.modules.auth.presentation.dto.TokenPairResponse;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Single-use refresh tokens. A presented token is revoked with a conditional update before its
 * successor is minted, so of two concurrent refreshes with the same token exactly one wins.
 */
@Service
@Transactional
public class RefreshTokenService {

    private static final Logger log = LoggerFactory.getLogger(RefreshTokenService.class);

    public static final String LOGGED_OUT_MESSAGE = "Logged out successfully";

    private final RefreshTokenRepository refreshTokenRepository;
    private final SessionTokenIssuer sessionTokenIssuer;
    private final TokenCodec tokenCodec;
    private final AuditTrail auditTrail;
    private final Clock clock;
    private final Duration refreshCooldown;

    public RefreshTokenService(
            RefreshTokenRepository refreshTokenRepository,
            SessionTokenIssuer sessionTokenIssuer,
            TokenCodec tokenCodec,
            AuditTrail auditTrail,
            Clock clock,
            @Value("${app.auth.refresh-cooldown:PT10S}") Duration refreshCooldown
    ) {
        this.refreshTokenRepository = refreshTokenRepository;
        this.sessionTokenIssuer = sessionTokenIssuer;
        this.tokenCodec = tokenCodec;
        this.auditTrail = auditTrail;
        this.clock = clock;
        this.refreshCooldown = refreshCooldown;
    }

    public TokenPairResponse refresh(RefreshRequest request, ClientMetadata client) {
        OffsetDateTime now = OffsetDateTime.now(clock);
        String deviceId = SessionTokenIssuer.normalizeDeviceId(request.deviceId());
        if (deviceId == null || request.refreshToken() == null) {
            throw AuthProblems.invalidRefreshToken();
        }

        RefreshToken stored = refreshTokenRepository
                .findActiveByTokenHashAndDeviceId(tokenCodec.digest(request.refreshToken()), deviceId)
                .filter(token -> tokenCodec.matches(request.refreshToken(), token.getTokenHash()))
                .orElseThrow(AuthProblems::invalidRefreshToken);

        if (stored.isExpiredAt(now)) {
            throw AuthProblems.invalidRefreshToken();
        }
        AppUser user = stored.getUser();
        if (!user.canSignIn()) {
            throw AuthProblems.invalidRefreshToken();
        }

        OffsetDateTime lastSeenAt = stored.getLastSeenAt();
        if (lastSeenAt != null) {
            Duration elapsed = Duration.between(lastSeenAt, now);
            if (elapsed.compareTo(refreshCooldown) < 0) {
                throw AuthProblems.refreshTooSoon(retryAfterSeconds(refreshCooldown.minus(elapsed)));
            }
        }

        if (refreshTokenRepository.revokeIfActive(stored.getId(), now, SessionRevocationReason.ROTATED) == 0) {
            log.warn("Refresh token {} was already rotated, rejecting reuse", stored.getId());
            throw AuthProblems.invalidRefreshToken();
        }

        TokenPairResponse tokens = sessionTokenIssuer.issue(
                user,
                new DeviceContext(deviceId, stored.getDeviceName(), client.ip(), client.userAgent()),
                now
        );

        auditTrail.enqueueAfterCommit(AuditAction.REFRESH, user.getId(), client.ip(), client.userAgent(),
                Map.of("deviceId", deviceId, "rotatedTokenId", String.valueOf(stored.getId())));
        return tokens;
    }

    public MessageResponse logout(LogoutRequest request, ClientMetadata client) {
        OffsetDateTime now = OffsetDateTime.now(clock);
        RefreshToken stored = refreshTokenRepository.findByTokenHash(tokenCodec.digest(request.refreshToken()))
                .filter(token -> tokenCodec.matches(request.refreshToken(), token.getTokenHash()))
                .filter(token -> !token.isRevoked())
                .orElseThrow(AuthProblems::refreshTokenNotFound);

        if (refreshTokenRepository.revokeIfActive(stored.getId(), now, SessionRevocationReason.LOGOUT) == 0) {
            throw AuthProblems.refreshTokenNotFound();
        }

        auditTrail.enqueueAfterCommit(AuditAction.LOGOUT, stored.getUser().getId(), client.ip(), client.userAgent(),
                Map.of("deviceId", stored.getDeviceId()));
        return new MessageResponse(LOGGED_OUT_MESSAGE);
    }

    /**
     * Revokes every live session of the user. Succeeds even when there is nothing to revoke.
     *
     * @return number of sessions revoked
     */
    public int logoutAll(UUID userId, SessionRevocationReason reason) {
        OffsetDateTime now = OffsetDateTime.now(clock);
        int revoked = refreshTokenRepository.revokeAllActiveByUserId(userId, now, reason);
        log.info("Revoked {} session(s) for user {} ({})", revoked, userId, reason);
        auditTrail.enqueueAfterCommit(AuditAction.TOKEN_REVOKED, userId, null, null,
                Map.of("reason", reason.name(), "revokedSessions", revoked));
        return revoked;
    }

    /**
     * Revokes every live session of the user except the ones held by {@code keepDeviceId}.
     * A null device keeps nothing.
     */
    public int logoutOtherDevices(UUID userId, String keepDeviceId, SessionRevocationReason reason) {
        if (keepDeviceId == null) {
            return logoutAll(userId, reason);
        }
        OffsetDateTime now = OffsetDateTime.now(clock);
        int revoked = refreshTokenRepository.revokeAllActiveByUserIdExceptDevice(userId, keepDeviceId, now, reason);
        log.info("Revoked {} session(s) on other devices for user {} ({})", revoked, userId, reason);
        auditTrail.enqueueAfterCommit(AuditAction.TOKEN_REVOKED, userId, null, null,
                Map.of("reason", reason.name(), "revokedSessions", revoked, "keptDeviceId", keepDeviceId));
        return revoked;
    }

    private static long retryAfterSeconds(Duration remaining) {
        long seconds = remaining.toSeconds();
        if (remaining.minusSeconds(seconds).isZero()) {
            return Math.max(1L, seconds);
        }
        return seconds + 1;
    }
}
