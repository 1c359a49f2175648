package com.storefront.backend.modules.auth.application;

import java.time.Clock;
import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

import com.storefront.backend.global.web.ClientMetadata;
import com.storefront.backend.modules.audit.application.AuditTrail;
import com.storefront.backend.modules.audit.domain.AuditAction;
import com.storefront.backend.modules.auth.domain.AppUser;
import com.storefront.backend.modules.auth.domain.PasswordResetToken;
import com.storefront.backend.modules.auth.domain.SessionRevocationReason;
import com.storefront.backend.modules.auth.infrastructure.persistence.AppUserRepository;
import com.storefront.backend.modules.auth.infrastructure.persistence.PasswordResetTokenRepository;
import com.storefront.backend.modules.auth.presentation.dto.MessageResponse;
import com.storefront.backend.modules.auth.presentation.dto.PasswordResetRequest;
import com.storefront.backend.modules.auth.presentation.dto.ResetPasswordRequest;
import com.storefront.backend.modules.auth.presentation.dto.ResetTokenStatusResponse;
import com.storefront.backend.modules.mail.application.AuthMailService;
import com.storefront.backend.modules.mail.application.MailDispatchException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;
import org.springframework.util.StringUtils;

/**
 * Forgot-password flow. Requests always receive the same answer whether or not the address
 * belongs to an account; mail is only sent after the token row has been committed.
 */
@Service
public class PasswordResetService {

    private static final Logger log = LoggerFactory.getLogger(PasswordResetService.class);

    public static final String RESET_REQUESTED_MESSAGE =
            "If an account with that email exists, a password reset link was sent. Please check your email.";
    public static final String PASSWORD_RESET_MESSAGE =
            "Your password has been reset successfully. Please log in with your new password.";

    private final AppUserRepository appUserRepository;
    private final PasswordResetTokenRepository passwordResetTokenRepository;
    private final RefreshTokenService refreshTokenService;
    private final TokenCodec tokenCodec;
    private final AuthMailService authMailService;
    private final AuditTrail auditTrail;
    private final TransactionTemplate transactionTemplate;
    private final Clock clock;
    private final Duration resetTtl;

    public PasswordResetService(
            AppUserRepository appUserRepository,
            PasswordResetTokenRepository passwordResetTokenRepository,
            RefreshTokenService refreshTokenService,
            TokenCodec tokenCodec,
            AuthMailService authMailService,
            AuditTrail auditTrail,
            PlatformTransactionManager transactionManager,
            Clock clock,
            @Value("${app.auth.password-reset-ttl:PT15M}") Duration resetTtl
    ) {
        this.appUserRepository = appUserRepository;
        this.passwordResetTokenRepository = passwordResetTokenRepository;
        this.refreshTokenService = refreshTokenService;
        this.tokenCodec = tokenCodec;
        this.authMailService = authMailService;
        this.auditTrail = auditTrail;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.clock = clock;
        this.resetTtl = resetTtl;
    }

    public MessageResponse requestReset(PasswordResetRequest request, ClientMetadata client) {
        String email = Emails.normalize(request.email());
        try {
            Optional<IssuedResetToken> issued = transactionTemplate.execute(status -> issueToken(email));
            if (issued != null) {
                issued.ifPresent(token -> deliver(token, client));
            }
        } catch (RuntimeException ex) {
            log.error("Password reset request for {} could not be processed", Emails.mask(email), ex);
        }
        return new MessageResponse(RESET_REQUESTED_MESSAGE);
    }

    public ResetTokenStatusResponse verifyResetToken(String rawToken) {
        if (!StringUtils.hasText(rawToken)) {
            throw AuthProblems.invalidResetToken();
        }
        OffsetDateTime now = OffsetDateTime.now(clock);
        return passwordResetTokenRepository.findByTokenHash(tokenCodec.digest(rawToken.trim()))
                .filter(token -> tokenCodec.matches(rawToken.trim(), token.getTokenHash()))
                .filter(token -> token.isRedeemableAt(now))
                .filter(token -> !token.getUser().isDeleted())
                .map(token -> new ResetTokenStatusResponse(true, Emails.mask(token.getUser().getEmail())))
                .orElseThrow(AuthProblems::invalidResetToken);
    }

    public MessageResponse resetPassword(ResetPasswordRequest request) {
        if (!StringUtils.hasText(request.token())) {
            throw AuthProblems.invalidResetToken();
        }
        OffsetDateTime now = OffsetDateTime.now(clock);
        PasswordResetToken token = passwordResetTokenRepository.findByTokenHash(tokenCodec.digest(request.token().trim()))
                .filter(candidate -> tokenCodec.matches(request.token().trim(), candidate.getTokenHash()))
                .filter(candidate -> candidate.isRedeemableAt(now))
                .orElseThrow(AuthProblems::invalidResetToken);
        AppUser user = token.getUser();
        if (user.isDeleted()) {
            throw AuthProblems.invalidResetToken();
        }
        UUID userId = user.getId();
        String newHash = tokenCodec.hashPassword(request.newPassword());

        try {
            transactionTemplate.executeWithoutResult(status -> {
                consume(token, now);
                applyNewPassword(userId, newHash, now);
            });
        } catch (TokenConsumptionException ex) {
            // the password change still goes through; the token expires on its own
            log.warn("Could not mark reset token {} as used", token.getId(), ex.getCause());
            transactionTemplate.executeWithoutResult(status -> applyNewPassword(userId, newHash, now));
        }

        log.info("Password reset completed for user {}", userId);
        auditTrail.enqueue(AuditAction.PASSWORD_RESET_COMPLETED, userId);
        return new MessageResponse(PASSWORD_RESET_MESSAGE);
    }

    private Optional<IssuedResetToken> issueToken(String email) {
        Optional<AppUser> found = appUserRepository.findActiveByEmail(email);
        if (found.isEmpty()) {
            log.debug("Password reset requested for unknown address");
            return Optional.empty();
        }
        AppUser user = found.get();
        if (!user.canSignIn()) {
            log.debug("Password reset requested for user {} that cannot sign in", user.getId());
            return Optional.empty();
        }

        OffsetDateTime now = OffsetDateTime.now(clock);
        passwordResetTokenRepository.invalidateUnusedByUserId(user.getId(), now);

        String rawToken = tokenCodec.generateToken(TokenCodec.RESET_TOKEN_BYTES);
        PasswordResetToken token = new PasswordResetToken();
        token.setUser(user);
        token.setTokenHash(tokenCodec.digest(rawToken));
        token.setExpiresAt(now.plus(resetTtl));
        passwordResetTokenRepository.save(token);

        return Optional.of(new IssuedResetToken(user.getId(), user.getEmail(), rawToken));
    }

    private void deliver(IssuedResetToken issued, ClientMetadata client) {
        try {
            authMailService.sendPasswordReset(issued.email(), issued.rawToken());
            auditTrail.enqueue(AuditAction.PASSWORD_RESET_REQUEST, issued.userId(), client.ip(), client.userAgent(),
                    Map.of("email", issued.email()));
        } catch (MailDispatchException ex) {
            log.error("Password reset mail could not be delivered to user {}", issued.userId(), ex);
            auditTrail.enqueue(AuditAction.EMAIL_SEND_FAILED, issued.userId(), client.ip(), client.userAgent(),
                    Map.of("email", issued.email(), "purpose", "PASSWORD_RESET"));
        }
    }

    private void consume(PasswordResetToken token, OffsetDateTime now) {
        int consumed;
        try {
            consumed = passwordResetTokenRepository.consumeIfUnused(token.getId(), now);
        } catch (DataAccessException ex) {
            throw new TokenConsumptionException(ex);
        }
        if (consumed == 0) {
            throw AuthProblems.invalidResetToken();
        }
    }

    private void applyNewPassword(UUID userId, String newHash, OffsetDateTime now) {
        appUserRepository.updatePasswordHash(userId, newHash, now);
        refreshTokenService.logoutAll(userId, SessionRevocationReason.PASSWORD_RESET);
    }

    /** Store failure while marking a reset token used. */
    private static final class TokenConsumptionException extends RuntimeException {

        TokenConsumptionException(DataAccessException cause) {
            super(cause);
        }
    }

    private record IssuedResetToken(UUID userId, String email, String rawToken) {
    }
}
