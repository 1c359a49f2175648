package com.storefront.backend.modules.auth.application;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

import com.storefront.backend.global.web.ClientMetadata;
import com.storefront.backend.modules.audit.application.AuditTrail;
import com.storefront.backend.modules.audit.domain.AuditAction;
import com.storefront.backend.modules.auth.domain.AppUser;
import com.storefront.backend.modules.auth.domain.SessionRevocationReason;
import com.storefront.backend.modules.auth.domain.UserRole;
import com.storefront.backend.modules.auth.infrastructure.persistence.AppUserRepository;
import com.storefront.backend.modules.auth.infrastructure.persistence.PasswordResetTokenRepository;
import com.storefront.backend.modules.auth.presentation.dto.UpdateProfileRequest;
import com.storefront.backend.modules.auth.presentation.dto.UserProfileResponse;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;
import org.springframework.transaction.annotation.Transactional;

@Service
@Transactional
public class AccountService {

    private static final Logger log = LoggerFactory.getLogger(AccountService.class);

    private final AppUserRepository appUserRepository;
    private final PasswordResetTokenRepository passwordResetTokenRepository;
    private final RefreshTokenService refreshTokenService;
    private final TokenCodec tokenCodec;
    private final AuditTrail auditTrail;
    private final Clock clock;

    public AccountService(
            AppUserRepository appUserRepository,
            PasswordResetTokenRepository passwordResetTokenRepository,
            RefreshTokenService refreshTokenService,
            TokenCodec tokenCodec,
            AuditTrail auditTrail,
            Clock clock
    ) {
        this.appUserRepository = appUserRepository;
        this.passwordResetTokenRepository = passwordResetTokenRepository;
        this.refreshTokenService = refreshTokenService;
        this.tokenCodec = tokenCodec;
        this.auditTrail = auditTrail;
        this.clock = clock;
    }

    @Transactional(readOnly = true)
    public UserProfileResponse loadProfile(UUID userId) {
        return toProfile(loadActiveUser(userId));
    }

    /**
     * Applies the non-null fields of {@code request}. A password change needs the current password
     * and signs out every device except {@code currentDeviceId}.
     */
    public UserProfileResponse updateProfile(UUID userId, String currentDeviceId, UpdateProfileRequest request,
                                             ClientMetadata client) {
        AppUser user = loadActiveUser(userId);
        List<String> changedFields = new ArrayList<>();

        if (request.displayName() != null) {
            String displayName = StringUtils.hasText(request.displayName()) ? request.displayName().trim() : null;
            if (!Objects.equals(displayName, user.getDisplayName())) {
                user.setDisplayName(displayName);
                changedFields.add("displayName");
            }
        }

        boolean passwordChanged = false;
        if (request.newPassword() != null) {
            if (!StringUtils.hasText(request.currentPassword())) {
                throw AuthProblems.currentPasswordRequired();
            }
            if (!tokenCodec.verifyPassword(request.currentPassword(), user.getPasswordHash())) {
                throw AuthProblems.currentPasswordIncorrect();
            }
            user.setPasswordHash(tokenCodec.hashPassword(request.newPassword()));
            changedFields.add("password");
            passwordChanged = true;
        }

        if (changedFields.isEmpty()) {
            return toProfile(user);
        }
        // flush so the auditing listener stamps updated_at before the response is built
        appUserRepository.saveAndFlush(user);
        if (passwordChanged) {
            passwordResetTokenRepository.invalidateUnusedByUserId(userId, OffsetDateTime.now(clock));
            refreshTokenService.logoutOtherDevices(userId, currentDeviceId, SessionRevocationReason.PASSWORD_CHANGED);
            log.info("Password changed for user {}", userId);
        }

        auditTrail.enqueueAfterCommit(AuditAction.UPDATE_PROFILE, userId, client.ip(), client.userAgent(),
                Map.of("changedFields", List.copyOf(changedFields)));
        return toProfile(user);
    }

    private static UserProfileResponse toProfile(AppUser user) {
        return new UserProfileResponse(
                user.getId(),
                user.getEmail(),
                user.getDisplayName(),
                user.getRole().name(),
                user.getProvider().name(),
                user.isEmailVerified(),
                user.getCreatedAt(),
                user.getUpdatedAt()
        );
    }

    /**
     * Soft-deletes the account and ends every session it holds. Admin accounts cannot delete themselves.
     */
    public void deleteAccount(UUID userId, ClientMetadata client) {
        AppUser user = loadActiveUser(userId);
        if (user.getRole() == UserRole.ADMIN) {
            throw AuthProblems.adminDeletionForbidden();
        }

        OffsetDateTime now = OffsetDateTime.now(clock);
        user.setDeletedAt(now);
        appUserRepository.save(user);
        passwordResetTokenRepository.invalidateUnusedByUserId(userId, now);
        refreshTokenService.logoutAll(userId, SessionRevocationReason.ACCOUNT_DELETED);

        auditTrail.enqueueAfterCommit(AuditAction.USER_DELETED, userId, client.ip(), client.userAgent(),
                Map.of("email", user.getEmail()));
    }

    private AppUser loadActiveUser(UUID userId) {
        return appUserRepository.findById(userId)
                .filter(user -> !user.isDeleted())
                .orElseThrow(AuthProblems::userNotFound);
    }
}
