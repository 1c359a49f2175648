package com.storefront.backend.modules.auth.application;

import java.util.Map;
import java.util.Optional;

import com.storefront.backend.global.web.ClientMetadata;
import com.storefront.backend.modules.audit.application.AuditTrail;
import com.storefront.backend.modules.audit.domain.AuditAction;
import com.storefront.backend.modules.auth.domain.AppUser;
import com.storefront.backend.modules.auth.infrastructure.persistence.AppUserRepository;
import com.storefront.backend.modules.auth.presentation.dto.LoginRequest;
import com.storefront.backend.modules.auth.presentation.dto.TokenPairResponse;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@Transactional
public class LoginService {

    private static final Logger log = LoggerFactory.getLogger(LoginService.class);

    private final AppUserRepository appUserRepository;
    private final SessionTokenIssuer sessionTokenIssuer;
    private final TokenCodec tokenCodec;
    private final AuditTrail auditTrail;
    // compared against when no usable hash exists so that every failure costs one BCrypt check
    private final String dummyPasswordHash;

    public LoginService(
            AppUserRepository appUserRepository,
            SessionTokenIssuer sessionTokenIssuer,
            TokenCodec tokenCodec,
            AuditTrail auditTrail
    ) {
        this.appUserRepository = appUserRepository;
        this.sessionTokenIssuer = sessionTokenIssuer;
        this.tokenCodec = tokenCodec;
        this.auditTrail = auditTrail;
        this.dummyPasswordHash = tokenCodec.hashPassword(tokenCodec.generateToken(16));
    }

    public TokenPairResponse login(LoginRequest request, ClientMetadata client) {
        String email = Emails.normalize(request.email());
        Optional<AppUser> candidate = appUserRepository.findActiveByEmail(email);

        String storedHash = candidate.map(AppUser::getPasswordHash).orElse(dummyPasswordHash);
        boolean passwordMatches = tokenCodec.verifyPassword(request.password(), storedHash);

        AppUser user = candidate
                .filter(found -> found.getPasswordHash() != null)
                .filter(AppUser::canSignIn)
                .filter(found -> passwordMatches)
                .orElse(null);

        if (user == null) {
            log.info("Login rejected for {}", Emails.mask(email));
            auditTrail.enqueue(AuditAction.LOGIN_FAILED, null, client.ip(), client.userAgent(),
                    Map.of("email", email));
            throw AuthProblems.invalidCredentials();
        }

        String deviceId = SessionTokenIssuer.normalizeDeviceId(request.deviceId());
        TokenPairResponse tokens = sessionTokenIssuer.issue(
                user,
                new DeviceContext(deviceId, request.deviceName(), client.ip(), client.userAgent()),
                null
        );

        auditTrail.enqueueAfterCommit(AuditAction.LOGIN_SUCCESS, user.getId(), client.ip(), client.userAgent(),
                Map.of("deviceId", deviceId));
        return tokens;
    }
}
