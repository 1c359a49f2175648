package com.storefront.backend.modules.auth.presentation;

import com.storefront.backend.global.security.JwtAuthenticationPrincipal;
import com.storefront.backend.global.web.ClientMetadata;
import com.storefront.backend.modules.auth.application.AccountService;
import com.storefront.backend.modules.auth.presentation.dto.MessageResponse;
import com.storefront.backend.modules.auth.presentation.dto.UpdateProfileRequest;
import com.storefront.backend.modules.auth.presentation.dto.UserProfileResponse;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;

import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class ProfileController {

    static final String ACCOUNT_DELETED_MESSAGE = "Account deleted";

    private final AccountService accountService;

    public ProfileController(AccountService accountService) {
        this.accountService = accountService;
    }

    @GetMapping("/profile/me")
    public ResponseEntity<UserProfileResponse> currentUser(@AuthenticationPrincipal JwtAuthenticationPrincipal principal) {
        return ResponseEntity.ok(accountService.loadProfile(principal.userId()));
    }

    @PatchMapping("/profile/me")
    public ResponseEntity<UserProfileResponse> updateCurrentUser(@AuthenticationPrincipal JwtAuthenticationPrincipal principal,
                                                                 @Valid @RequestBody UpdateProfileRequest request,
                                                                 HttpServletRequest httpRequest) {
        return ResponseEntity.ok(accountService.updateProfile(principal.userId(), principal.deviceId(), request,
                ClientMetadata.from(httpRequest)));
    }

    @DeleteMapping("/profile/me")
    public ResponseEntity<MessageResponse> deleteCurrentUser(@AuthenticationPrincipal JwtAuthenticationPrincipal principal,
                                                             HttpServletRequest httpRequest) {
        accountService.deleteAccount(principal.userId(), ClientMetadata.from(httpRequest));
        return ResponseEntity.ok(new MessageResponse(ACCOUNT_DELETED_MESSAGE));
    }
}
