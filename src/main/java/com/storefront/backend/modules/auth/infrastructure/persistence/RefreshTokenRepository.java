package com.storefront.backend.modules.auth.infrastructure.persistence;

import java.time.OffsetDateTime;
import java.util.Optional;
import java.util.UUID;

import com.storefront.backend.modules.auth.domain.RefreshToken;
import com.storefront.backend.modules.auth.domain.SessionRevocationReason;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface RefreshTokenRepository extends JpaRepository<RefreshToken, UUID> {

    @Query("""
            select rt
              from RefreshToken rt
              join fetch rt.user
             where rt.tokenHash = :tokenHash
               and rt.deviceId = :deviceId
               and rt.revoked = false
            """)
    Optional<RefreshToken> findActiveByTokenHashAndDeviceId(@Param("tokenHash") String tokenHash,
                                                           @Param("deviceId") String deviceId);

    @Query("select rt from RefreshToken rt join fetch rt.user where rt.tokenHash = :tokenHash")
    Optional<RefreshToken> findByTokenHash(@Param("tokenHash") String tokenHash);

    /**
     * Check-and-set on the revoked flag. Exactly one of several concurrent callers gets 1.
     */
    @Modifying
    @Query("""
            update RefreshToken rt
               set rt.revoked = true,
                   rt.revokedAt = :now,
                   rt.revokedReason = :reason,
                   rt.lastSeenAt = :now,
                   rt.updatedAt = :now
             where rt.id = :id
               and rt.revoked = false
            """)
    int revokeIfActive(@Param("id") UUID id,
                       @Param("now") OffsetDateTime now,
                       @Param("reason") SessionRevocationReason reason);

    @Modifying
    @Query("""
            update RefreshToken rt
               set rt.revoked = true,
                   rt.revokedAt = :now,
                   rt.revokedReason = :reason,
                   rt.updatedAt = :now
             where rt.user.id = :userId
               and rt.revoked = false
            """)
    int revokeAllActiveByUserId(@Param("userId") UUID userId,
                                @Param("now") OffsetDateTime now,
                                @Param("reason") SessionRevocationReason reason);

    @Modifying
    @Query("""
            update RefreshToken rt
               set rt.revoked = true,
                   rt.revokedAt = :now,
                   rt.revokedReason = :reason,
                   rt.updatedAt = :now
             where rt.user.id = :userId
               and rt.revoked = false
               and rt.deviceId <> :deviceId
            """)
    int revokeAllActiveByUserIdExceptDevice(@Param("userId") UUID userId,
                                            @Param("deviceId") String deviceId,
                                            @Param("now") OffsetDateTime now,
                                            @Param("reason") SessionRevocationReason reason);

    @Query("select count(rt) from RefreshToken rt where rt.user.id = :userId and rt.revoked = false")
    long countActiveByUserId(@Param("userId") UUID userId);
}
