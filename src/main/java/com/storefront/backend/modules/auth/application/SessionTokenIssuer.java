package com.storefront.backend.modules.auth.application;

import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.List;

import com.storefront.backend.modules.auth.application.JwtTokenService.AccessToken;
import com.storefront.backend.modules.auth.domain.AppUser;
import com.storefront.backend.modules.auth.domain.RefreshToken;
import com.storefront.backend.modules.auth.infrastructure.persistence.RefreshTokenRepository;
import com.storefront.backend.modules.auth.presentation.dto.TokenPairResponse;

import org.springframework.stereotype.Component;

/**
 * Mints an access/refresh pair for a user on one device and persists the refresh token digest.
 * The raw refresh token only ever leaves through the returned response.
 */
@Component
public class SessionTokenIssuer {

    static final int DEVICE_ID_MAX_LENGTH = 100;

    private final JwtTokenService jwtTokenService;
    private final RefreshTokenRepository refreshTokenRepository;
    private final TokenCodec tokenCodec;

    public SessionTokenIssuer(
            JwtTokenService jwtTokenService,
            RefreshTokenRepository refreshTokenRepository,
            TokenCodec tokenCodec
    ) {
        this.jwtTokenService = jwtTokenService;
        this.refreshTokenRepository = refreshTokenRepository;
        this.tokenCodec = tokenCodec;
    }

    /**
     * @param lastSeenAt stamped on the new refresh token; rotation passes its own instant so that
     *                   an immediate second refresh can be rate limited, login passes {@code null}
     */
    public TokenPairResponse issue(AppUser user, DeviceContext device, OffsetDateTime lastSeenAt) {
        AccessToken accessToken = jwtTokenService.issueAccessToken(
                user.getId(),
                user.getEmail(),
                List.of(user.getRole().name()),
                device.deviceId()
        );

        Duration refreshTtl = Duration.ofMillis(jwtTokenService.getRefreshTokenTtlMillis());
        String rawRefreshToken = tokenCodec.generateToken(TokenCodec.REFRESH_TOKEN_BYTES);

        RefreshToken refreshToken = new RefreshToken();
        refreshToken.setUser(user);
        refreshToken.setTokenHash(tokenCodec.digest(rawRefreshToken));
        refreshToken.setDeviceId(device.deviceId());
        refreshToken.setDeviceName(device.deviceName());
        refreshToken.setIp(device.ip());
        refreshToken.setUserAgent(device.userAgent());
        refreshToken.setLastSeenAt(lastSeenAt);
        refreshToken.setExpiresAt(accessToken.issuedAt().plus(refreshTtl));
        refreshTokenRepository.save(refreshToken);

        return new TokenPairResponse(
                accessToken.token(),
                TokenPairResponse.DEFAULT_TOKEN_TYPE,
                accessToken.expiresInSeconds(),
                rawRefreshToken,
                refreshTtl.toSeconds(),
                accessToken.issuedAt()
        );
    }

    static String normalizeDeviceId(String rawDeviceId) {
        if (rawDeviceId == null) {
            return null;
        }
        String trimmed = rawDeviceId.trim();
        if (trimmed.isEmpty()) {
            return null;
        }
        if (trimmed.length() > DEVICE_ID_MAX_LENGTH) {
            return trimmed.substring(0, DEVICE_ID_MAX_LENGTH);
        }
        return trimmed;
    }
}
