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
import com.storefront.backend.modules.auth.domain.AuthProvider;
import com.storefront.backend.modules.auth.domain.PreRegistration;
import com.storefront.backend.modules.auth.infrastructure.persistence.AppUserRepository;
import com.storefront.backend.modules.auth.infrastructure.persistence.PreRegistrationRepository;
import com.storefront.backend.modules.auth.presentation.dto.MessageResponse;
import com.storefront.backend.modules.auth.presentation.dto.RegisterRequest;
import com.storefront.backend.modules.mail.application.AuthMailService;
import com.storefront.backend.modules.mail.application.MailDispatchException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.StringUtils;

/**
 * Two-phase sign-up. {@link #register} parks the credentials in a pre-registration and mails a
 * link; {@link #verifyEmail} redeems the link exactly once and creates the verified account.
 */
@Service
@Transactional
public class RegistrationService {

    private static final Logger log = LoggerFactory.getLogger(RegistrationService.class);

    public static final String VERIFICATION_SENT_MESSAGE = "Verification email sent. Please check your inbox.";
    public static final String EMAIL_VERIFIED_MESSAGE = "Email successfully verified";

    private final AppUserRepository appUserRepository;
    private final PreRegistrationRepository preRegistrationRepository;
    private final TokenCodec tokenCodec;
    private final AuthMailService authMailService;
    private final AuditTrail auditTrail;
    private final Clock clock;
    private final Duration verificationTtl;

    public RegistrationService(
            AppUserRepository appUserRepository,
            PreRegistrationRepository preRegistrationRepository,
            TokenCodec tokenCodec,
            AuthMailService authMailService,
            AuditTrail auditTrail,
            Clock clock,
            @Value("${app.auth.verification-ttl:PT1H}") Duration verificationTtl
    ) {
        this.appUserRepository = appUserRepository;
        this.preRegistrationRepository = preRegistrationRepository;
        this.tokenCodec = tokenCodec;
        this.authMailService = authMailService;
        this.auditTrail = auditTrail;
        this.clock = clock;
        this.verificationTtl = verificationTtl;
    }

    public MessageResponse register(RegisterRequest request, ClientMetadata client) {
        String email = Emails.normalize(request.email());
        if (appUserRepository.findActiveByEmail(email).filter(AppUser::isEmailVerified).isPresent()) {
            throw AuthProblems.emailAlreadyRegistered();
        }

        OffsetDateTime now = OffsetDateTime.now(clock);
        String rawToken = tokenCodec.generateToken(TokenCodec.VERIFICATION_TOKEN_BYTES);

        preRegistrationRepository.upsertByEmail(
                UUID.randomUUID(),
                email,
                tokenCodec.hashPassword(request.password()),
                normalizeDisplayName(request.displayName()),
                tokenCodec.digest(rawToken),
                now.plus(verificationTtl),
                client.ip(),
                client.userAgent(),
                now
        );

        try {
            authMailService.sendVerification(email, rawToken);
        } catch (MailDispatchException ex) {
            auditTrail.enqueue(AuditAction.EMAIL_SEND_FAILED, null, client.ip(), client.userAgent(),
                    Map.of("email", email, "purpose", "VERIFICATION"));
            throw AuthProblems.mailDispatchFailed(ex);
        }

        auditTrail.enqueueAfterCommit(AuditAction.REGISTER_REQUEST, null, client.ip(), client.userAgent(),
                Map.of("email", email));
        return new MessageResponse(VERIFICATION_SENT_MESSAGE);
    }

    public MessageResponse verifyEmail(String rawToken) {
        if (!StringUtils.hasText(rawToken)) {
            throw AuthProblems.invalidOrExpiredToken();
        }
        String tokenHash = tokenCodec.digest(rawToken.trim());
        OffsetDateTime now = OffsetDateTime.now(clock);

        PreRegistration pending = preRegistrationRepository.findByVerificationTokenHash(tokenHash)
                .filter(candidate -> tokenCodec.matches(rawToken.trim(), candidate.getVerificationTokenHash()))
                .orElseThrow(AuthProblems::invalidOrExpiredToken);
        if (pending.isExpiredAt(now)) {
            throw AuthProblems.invalidOrExpiredToken();
        }

        // the conditional delete is the redemption; a concurrent verifier sees zero rows
        if (preRegistrationRepository.deleteByIdAndTokenHash(pending.getId(), tokenHash) == 0) {
            throw AuthProblems.invalidOrExpiredToken();
        }

        Optional<AppUser> existing = appUserRepository.findActiveByEmail(pending.getEmail());
        if (existing.filter(AppUser::isEmailVerified).isPresent()) {
            throw AuthProblems.emailAlreadyRegistered();
        }

        AppUser user = existing.orElseGet(AppUser::new);
        user.setEmail(pending.getEmail());
        user.setPasswordHash(pending.getPasswordHash());
        user.setDisplayName(pending.getDisplayName());
        user.setProvider(AuthProvider.LOCAL);
        user.setEmailVerified(true);
        AppUser saved = appUserRepository.save(user);

        log.info("Email verified for user {}", saved.getId());
        auditTrail.enqueueAfterCommit(AuditAction.EMAIL_VERIFIED, saved.getId(), pending.getIp(), pending.getUserAgent(),
                Map.of("email", pending.getEmail()));
        return new MessageResponse(EMAIL_VERIFIED_MESSAGE);
    }

    private static String normalizeDisplayName(String displayName) {
        if (!StringUtils.hasText(displayName)) {
            return null;
        }
        return displayName.trim();
    }
}
