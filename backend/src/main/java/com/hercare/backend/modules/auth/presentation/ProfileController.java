package com.hercare.backend.modules.auth.presentation;

import com.hercare.backend.global.security.JwtAuthenticationPrincipal;
import com.hercare.backend.modules.auth.application.AuthService;
import com.hercare.backend.modules.auth.presentation.dto.UpdateProfileRequest;
import com.hercare.backend.modules.auth.presentation.dto.UserProfileResponse;

import jakarta.validation.Valid;

import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class ProfileController {

    private final AuthService authService;

    public ProfileController(AuthService authService) {
        this.authService = authService;
    }

    @GetMapping("/profile")
    public ResponseEntity<UserProfileResponse> currentUser(@AuthenticationPrincipal JwtAuthenticationPrincipal principal) {
        return ResponseEntity.ok(authService.loadProfile(principal.userId()));
    }

    @PutMapping("/profile")
    public ResponseEntity<UserProfileResponse> updateCurrentUser(
            @AuthenticationPrincipal JwtAuthenticationPrincipal principal,
            @Valid @RequestBody UpdateProfileRequest request
    ) {
        return ResponseEntity.ok(authService.updateProfile(principal.userId(), request));
    }
}
