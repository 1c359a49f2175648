package com.storefront.backend.modules.auth.application;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicBoolean;

import com.storefront.backend.global.error.ProblemException;
import com.storefront.backend.global.error.RetryableProblemException;
import com.storefront.backend.global.web.ClientMetadata;
import com.storefront.backend.modules.audit.application.AuditTrail;
import com.storefront.backend.modules.audit.domain.AuditAction;
import com.storefront.backend.modules.auth.domain.AppUser;
import com.storefront.backend.modules.auth.domain.RefreshToken;
import com.storefront.backend.modules.auth.domain.SessionRevocationReason;
import com.storefront.backend.modules.auth.infrastructure.persistence.RefreshTokenRepository;
import com.storefront.backend.modules.auth.presentation.dto.LogoutRequest;
import com.storefront.backend.modules.auth.presentation.dto.RefreshRequest;
import com.storefront.backend.modules.auth.presentation.dto.TokenPairResponse;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.HttpStatus;
import org.springframework.security.crypto.bcrypt.BCryptPasswordEncoder;
import org.springframework.test.util.ReflectionTestUtils;

@ExtendWith(MockitoExtension.class)
class RefreshTokenServiceTest {

    private static final Instant NOW = Instant.parse("2024-05-01T10:00:00Z");
    private static final ClientMetadata CLIENT = new ClientMetadata("10.0.0.1", "JUnit");
    private static final String RAW_TOKEN = "f".repeat(128);

    @Mock
    private RefreshTokenRepository refreshTokenRepository;

    @Mock
    private SessionTokenIssuer sessionTokenIssuer;

    @Mock
    private AuditTrail auditTrail;

    private final TokenCodec tokenCodec = new TokenCodec(new BCryptPasswordEncoder(4));
    private final MutableClock clock = new MutableClock(NOW);

    private RefreshTokenService refreshTokenService;
    private AppUser user;

    @BeforeEach
    void setUp() {
        refreshTokenService = new RefreshTokenService(
                refreshTokenRepository, sessionTokenIssuer, tokenCodec, auditTrail, clock, Duration.ofSeconds(10));
        user = new AppUser();
        ReflectionTestUtils.setField(user, "id", UUID.randomUUID());
        user.setEmail("alice@example.com");
        user.setPasswordHash("hash");
        user.setEmailVerified(true);
    }

    @Test
    void refreshRevokesPresentedTokenBeforeIssuingSuccessor() {
        RefreshToken stored = storedToken(null, NOW.plusSeconds(3600));
        stubLookup(stored);
        when(refreshTokenRepository.revokeIfActive(stored.getId(), now(), SessionRevocationReason.ROTATED)).thenReturn(1);
        TokenPairResponse next = pair("next");
        when(sessionTokenIssuer.issue(eq(user), any(DeviceContext.class), eq(now()))).thenReturn(next);

        TokenPairResponse response = refreshTokenService.refresh(new RefreshRequest(RAW_TOKEN, " laptop "), CLIENT);

        assertThat(response).isSameAs(next);
        verify(sessionTokenIssuer).issue(user, new DeviceContext("laptop", "Work laptop", "10.0.0.1", "JUnit"), now());
        verify(auditTrail).enqueueAfterCommit(eq(AuditAction.REFRESH), eq(user.getId()), eq("10.0.0.1"), eq("JUnit"), anyMap());
    }

    @Test
    void unknownTokenOrOtherDeviceIsRejected() {
        when(refreshTokenRepository.findActiveByTokenHashAndDeviceId(tokenCodec.digest(RAW_TOKEN), "phone"))
                .thenReturn(Optional.empty());

        assertThatThrownBy(() -> refreshTokenService.refresh(new RefreshRequest(RAW_TOKEN, "phone"), CLIENT))
                .isInstanceOfSatisfying(ProblemException.class, ex -> {
                    assertThat(ex.getStatusCode()).isEqualTo(HttpStatus.UNAUTHORIZED);
                    assertThat(ex.getCode()).isEqualTo(AuthProblems.INVALID_REFRESH_TOKEN);
                });
        assertThatThrownBy(() -> refreshTokenService.refresh(new RefreshRequest(RAW_TOKEN, "  "), CLIENT))
                .isInstanceOf(ProblemException.class);
        verify(sessionTokenIssuer, never()).issue(any(), any(), any());
    }

    @Test
    void rowWhoseDigestDiffersFromPresentedTokenIsRejected() {
        RefreshToken stored = storedToken(null, NOW.plusSeconds(3600));
        stored.setTokenHash(tokenCodec.digest("e".repeat(128)));
        stubLookup(stored);

        assertThatThrownBy(() -> refreshTokenService.refresh(new RefreshRequest(RAW_TOKEN, "laptop"), CLIENT))
                .isInstanceOfSatisfying(ProblemException.class,
                        ex -> assertThat(ex.getCode()).isEqualTo(AuthProblems.INVALID_REFRESH_TOKEN));
        verify(refreshTokenRepository, never()).revokeIfActive(any(), any(), any());
    }

    @Test
    void expiredTokenAndLockedUserAreRejected() {
        RefreshToken expired = storedToken(null, NOW);
        stubLookup(expired);

        assertThatThrownBy(() -> refreshTokenService.refresh(new RefreshRequest(RAW_TOKEN, "laptop"), CLIENT))
                .isInstanceOfSatisfying(ProblemException.class,
                        ex -> assertThat(ex.getCode()).isEqualTo(AuthProblems.INVALID_REFRESH_TOKEN));

        expired.setExpiresAt(OffsetDateTime.ofInstant(NOW.plusSeconds(60), ZoneOffset.UTC));
        user.setDisabled(true);
        assertThatThrownBy(() -> refreshTokenService.refresh(new RefreshRequest(RAW_TOKEN, "laptop"), CLIENT))
                .isInstanceOf(ProblemException.class);
        verify(refreshTokenRepository, never()).revokeIfActive(any(), any(), any());
    }

    @Test
    void rotatedTokenRefreshedWithinCooldownIsThrottled() {
        RefreshToken rotated = storedToken(NOW.minusSeconds(3), NOW.plusSeconds(3600));
        stubLookup(rotated);

        assertThatThrownBy(() -> refreshTokenService.refresh(new RefreshRequest(RAW_TOKEN, "laptop"), CLIENT))
                .isInstanceOfSatisfying(RetryableProblemException.class, ex -> {
                    assertThat(ex.getStatusCode()).isEqualTo(HttpStatus.TOO_MANY_REQUESTS);
                    assertThat(ex.getCode()).isEqualTo(AuthProblems.REFRESH_TOO_SOON);
                    assertThat(ex.getRetryAfterSeconds()).isEqualTo(7);
                });
        verify(refreshTokenRepository, never()).revokeIfActive(any(), any(), any());

        clock.advance(Duration.ofSeconds(7));
        when(refreshTokenRepository.revokeIfActive(rotated.getId(), now(), SessionRevocationReason.ROTATED)).thenReturn(1);
        when(sessionTokenIssuer.issue(eq(user), any(DeviceContext.class), eq(now()))).thenReturn(pair("later"));

        assertThat(refreshTokenService.refresh(new RefreshRequest(RAW_TOKEN, "laptop"), CLIENT).accessToken())
                .isEqualTo("later");
    }

    @Test
    void concurrentRefreshesWithSameTokenProduceExactlyOneWinner() throws Exception {
        RefreshToken stored = storedToken(null, NOW.plusSeconds(3600));
        stubLookup(stored);
        AtomicBoolean revoked = new AtomicBoolean(false);
        when(refreshTokenRepository.revokeIfActive(stored.getId(), now(), SessionRevocationReason.ROTATED))
                .thenAnswer(invocation -> revoked.compareAndSet(false, true) ? 1 : 0);
        when(sessionTokenIssuer.issue(eq(user), any(DeviceContext.class), eq(now()))).thenReturn(pair("winner"));

        int attempts = 8;
        CountDownLatch start = new CountDownLatch(1);
        ExecutorService pool = Executors.newFixedThreadPool(attempts);
        try {
            List<Future<Boolean>> results = new ArrayList<>();
            for (int i = 0; i < attempts; i++) {
                Callable<Boolean> attempt = () -> {
                    start.await();
                    try {
                        refreshTokenService.refresh(new RefreshRequest(RAW_TOKEN, "laptop"), CLIENT);
                        return true;
                    } catch (ProblemException ex) {
                        assertThat(ex.getCode()).isEqualTo(AuthProblems.INVALID_REFRESH_TOKEN);
                        return false;
                    }
                };
                results.add(pool.submit(attempt));
            }
            start.countDown();

            int winners = 0;
            for (Future<Boolean> result : results) {
                if (result.get()) {
                    winners++;
                }
            }
            assertThat(winners).isEqualTo(1);
        } finally {
            pool.shutdownNow();
        }
        verify(sessionTokenIssuer, times(1)).issue(any(), any(), any());
    }

    @Test
    void logoutRevokesLiveTokenAndRejectsUnknownOrRevoked() {
        RefreshToken stored = storedToken(null, NOW.plusSeconds(3600));
        when(refreshTokenRepository.findByTokenHash(tokenCodec.digest(RAW_TOKEN))).thenReturn(Optional.of(stored));
        when(refreshTokenRepository.revokeIfActive(stored.getId(), now(), SessionRevocationReason.LOGOUT)).thenReturn(1);

        assertThat(refreshTokenService.logout(new LogoutRequest(RAW_TOKEN), CLIENT).message())
                .isEqualTo(RefreshTokenService.LOGGED_OUT_MESSAGE);
        verify(auditTrail).enqueueAfterCommit(eq(AuditAction.LOGOUT), eq(user.getId()), any(), any(), anyMap());

        stored.setRevoked(true);
        assertThatThrownBy(() -> refreshTokenService.logout(new LogoutRequest(RAW_TOKEN), CLIENT))
                .isInstanceOfSatisfying(ProblemException.class, ex -> {
                    assertThat(ex.getStatusCode()).isEqualTo(HttpStatus.NOT_FOUND);
                    assertThat(ex.getCode()).isEqualTo(AuthProblems.REFRESH_TOKEN_NOT_FOUND);
                });
    }

    @Test
    void logoutAllSucceedsEvenWithoutSessions() {
        when(refreshTokenRepository.revokeAllActiveByUserId(user.getId(), now(), SessionRevocationReason.LOGOUT_ALL))
                .thenReturn(0);

        assertThat(refreshTokenService.logoutAll(user.getId(), SessionRevocationReason.LOGOUT_ALL)).isZero();
        verify(auditTrail).enqueueAfterCommit(eq(AuditAction.TOKEN_REVOKED), eq(user.getId()), any(), any(), anyMap());
    }

    @Test
    void logoutOtherDevicesKeepsTheCallingDevice() {
        when(refreshTokenRepository.revokeAllActiveByUserIdExceptDevice(
                user.getId(), "laptop", now(), SessionRevocationReason.PASSWORD_CHANGED)).thenReturn(2);

        assertThat(refreshTokenService.logoutOtherDevices(user.getId(), "laptop", SessionRevocationReason.PASSWORD_CHANGED))
                .isEqualTo(2);
        verify(refreshTokenRepository, never()).revokeAllActiveByUserId(any(), any(), any());
        verify(auditTrail).enqueueAfterCommit(eq(AuditAction.TOKEN_REVOKED), eq(user.getId()), any(), any(), anyMap());
    }

    private void stubLookup(RefreshToken stored) {
        when(refreshTokenRepository.findActiveByTokenHashAndDeviceId(tokenCodec.digest(RAW_TOKEN), "laptop"))
                .thenReturn(Optional.of(stored));
    }

    private RefreshToken storedToken(Instant lastSeenAt, Instant expiresAt) {
        RefreshToken token = new RefreshToken();
        ReflectionTestUtils.setField(token, "id", UUID.randomUUID());
        token.setUser(user);
        token.setTokenHash(tokenCodec.digest(RAW_TOKEN));
        token.setDeviceId("laptop");
        token.setDeviceName("Work laptop");
        token.setLastSeenAt(lastSeenAt == null ? null : OffsetDateTime.ofInstant(lastSeenAt, ZoneOffset.UTC));
        token.setExpiresAt(OffsetDateTime.ofInstant(expiresAt, ZoneOffset.UTC));
        return token;
    }

    private OffsetDateTime now() {
        return OffsetDateTime.now(clock);
    }

    private static TokenPairResponse pair(String accessToken) {
        return new TokenPairResponse(accessToken, TokenPairResponse.DEFAULT_TOKEN_TYPE, 900, "refresh", 604800,
                OffsetDateTime.ofInstant(NOW, ZoneOffset.UTC));
    }

    private static final class MutableClock extends Clock {

        private Instant instant;

        private MutableClock(Instant instant) {
            this.instant = instant;
        }

        void advance(Duration duration) {
            instant = instant.plus(duration);
        }

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return instant;
        }
    }
}
