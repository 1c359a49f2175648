package com.storefront.backend.modules.auth.application;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.UUID;

import com.storefront.backend.modules.auth.application.JwtTokenService.AccessToken;
import com.storefront.backend.modules.auth.application.JwtTokenService.InvalidTokenException;
import com.storefront.backend.modules.auth.application.JwtTokenService.ParsedToken;
import com.storefront.backend.modules.auth.infrastructure.jwt.JwtTokenProvider;

import org.junit.jupiter.api.Test;

class JwtTokenServiceTest {

    private static final String SECRET = "unit-test-secret-that-is-long-enough-for-hs256";
    private static final Instant NOW = Instant.parse("2024-05-01T10:00:00Z");

    private final JwtTokenProvider provider = new JwtTokenProvider(SECRET);

    @Test
    void issuedTokenCarriesIdentityClaims() {
        JwtTokenService service = serviceAt(NOW);
        UUID userId = UUID.randomUUID();

        AccessToken issued = service.issueAccessToken(userId, "alice@example.com", List.of("CUSTOMER"), "laptop");
        ParsedToken parsed = service.parseAccessToken(issued.token());

        assertThat(issued.expiresInSeconds()).isEqualTo(900);
        assertThat(parsed.userId()).isEqualTo(userId);
        assertThat(parsed.email()).isEqualTo("alice@example.com");
        assertThat(parsed.roles()).containsExactly("CUSTOMER");
        assertThat(parsed.deviceId()).isEqualTo("laptop");
        assertThat(Duration.between(parsed.issuedAt(), parsed.expiresAt())).isEqualTo(Duration.ofMinutes(15));
    }

    @Test
    void expiredTokenIsRejected() {
        String token = serviceAt(NOW).issueAccessToken(UUID.randomUUID(), "a@b.c", List.of("CUSTOMER"), "d").token();

        JwtTokenService later = serviceAt(NOW.plus(Duration.ofMinutes(16)));

        assertThatThrownBy(() -> later.parseAccessToken(token)).isInstanceOf(InvalidTokenException.class);
    }

    @Test
    void tokenSignedWithAnotherKeyIsRejected() {
        JwtTokenService other = new JwtTokenService(
                new JwtTokenProvider("another-secret-that-is-also-long-enough-for-hs256"),
                900_000L, 604_800_000L, Clock.fixed(NOW, ZoneOffset.UTC));
        String foreign = other.issueAccessToken(UUID.randomUUID(), "a@b.c", List.of("ADMIN"), "d").token();

        assertThatThrownBy(() -> serviceAt(NOW).parseAccessToken(foreign)).isInstanceOf(InvalidTokenException.class);
        assertThatThrownBy(() -> serviceAt(NOW).parseAccessToken("not-a-jwt")).isInstanceOf(InvalidTokenException.class);
    }

    private JwtTokenService serviceAt(Instant instant) {
        return new JwtTokenService(provider, 900_000L, 604_800_000L, Clock.fixed(instant, ZoneOffset.UTC));
    }
}
