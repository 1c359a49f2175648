package com.storefront.backend.modules.auth.infrastructure.persistence;

import java.time.OffsetDateTime;
import java.util.Optional;
import java.util.UUID;

import com.storefront.backend.modules.auth.domain.PreRegistration;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface PreRegistrationRepository extends JpaRepository<PreRegistration, UUID> {

    Optional<PreRegistration> findByEmail(String email);

    Optional<PreRegistration> findByVerificationTokenHash(String verificationTokenHash);

    /**
     * Inserts the pending sign-up or overwrites the existing row for the same email.
     * The row id is kept on conflict; {@code id} is only used for a fresh insert.
     */
    @Modifying
    @Query(value = """
            insert into pre_registration (
                id, email, password_hash, display_name, verification_token_hash,
                expires_at, ip, user_agent, created_at, updated_at
            ) values (
                :id, :email, :passwordHash, cast(:displayName as varchar), :tokenHash,
                :expiresAt, cast(:ip as varchar), cast(:userAgent as varchar), :now, :now
            )
            on conflict (email) do update
               set password_hash = excluded.password_hash,
                   display_name = excluded.display_name,
                   verification_token_hash = excluded.verification_token_hash,
                   expires_at = excluded.expires_at,
                   ip = excluded.ip,
                   user_agent = excluded.user_agent,
                   updated_at = excluded.updated_at
            """, nativeQuery = true)
    int upsertByEmail(@Param("id") UUID id,
                      @Param("email") String email,
                      @Param("passwordHash") String passwordHash,
                      @Param("displayName") String displayName,
                      @Param("tokenHash") String tokenHash,
                      @Param("expiresAt") OffsetDateTime expiresAt,
                      @Param("ip") String ip,
                      @Param("userAgent") String userAgent,
                      @Param("now") OffsetDateTime now);

    /**
     * Deletes the row only while it still carries the presented token digest.
     * Returns 0 when a concurrent verification or a re-registration got there first.
     */
    @Modifying
    @Query("delete from PreRegistration p where p.id = :id and p.verificationTokenHash = :tokenHash")
    int deleteByIdAndTokenHash(@Param("id") UUID id, @Param("tokenHash") String tokenHash);

    @Modifying
    @Query("delete from PreRegistration p where p.expiresAt < :now")
    int deleteExpired(@Param("now") OffsetDateTime now);
}
