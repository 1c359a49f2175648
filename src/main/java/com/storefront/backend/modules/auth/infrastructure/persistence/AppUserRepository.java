package com.storefront.backend.modules.auth.infrastructure.persistence;

import java.time.OffsetDateTime;
import java.util.Optional;
import java.util.UUID;

import com.storefront.backend.modules.auth.domain.AppUser;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface AppUserRepository extends JpaRepository<AppUser, UUID> {

    /**
     * Emails are normalized before they reach the store, so this is an exact match.
     */
    @Query("select u from AppUser u where u.email = :email and u.deletedAt is null")
    Optional<AppUser> findActiveByEmail(@Param("email") String email);

    @Modifying
    @Query("update AppUser u set u.passwordHash = :passwordHash, u.updatedAt = :now where u.id = :userId")
    int updatePasswordHash(@Param("userId") UUID userId,
                           @Param("passwordHash") String passwordHash,
                           @Param("now") OffsetDateTime now);
}
