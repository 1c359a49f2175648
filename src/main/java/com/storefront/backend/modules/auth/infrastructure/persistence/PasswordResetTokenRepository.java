package com.storefront.backend.modules.auth.infrastructure.persistence;

import java.time.OffsetDateTime;
import java.util.Optional;
import java.util.UUID;

import com.storefront.backend.modules.auth.domain.PasswordResetToken;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface PasswordResetTokenRepository extends JpaRepository<PasswordResetToken, UUID> {

    @Query("select t from PasswordResetToken t join fetch t.user where t.tokenHash = :tokenHash")
    Optional<PasswordResetToken> findByTokenHash(@Param("tokenHash") String tokenHash);

    @Modifying
    @Query("""
            update PasswordResetToken t
               set t.used = true,
                   t.updatedAt = :now
             where t.user.id = :userId
               and t.used = false
            """)
    int invalidateUnusedByUserId(@Param("userId") UUID userId, @Param("now") OffsetDateTime now);

    /**
     * Marks the token used only if it is still unused and unexpired; 0 means someone else redeemed it.
     */
    @Modifying
    @Query("""
            update PasswordResetToken t
               set t.used = true,
                   t.updatedAt = :now
             where t.id = :id
               and t.used = false
               and t.expiresAt > :now
            """)
    int consumeIfUnused(@Param("id") UUID id, @Param("now") OffsetDateTime now);

    @Query("select count(t) from PasswordResetToken t where t.user.id = :userId and t.used = false")
    long countUnusedByUserId(@Param("userId") UUID userId);
}
