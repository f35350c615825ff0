package com.studio45.backend.modules.auth.presentation;

import com.studio45.backend.global.security.JwtAuthenticationPrincipal;
import com.studio45.backend.modules.auth.application.AuthService;
import com.studio45.backend.modules.auth.presentation.dto.UserProfileResponse;

import com.fasterxml.jackson.databind.JsonNode;

import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/protected/profile")
public class ProfileController {

    private final AuthService authService;
    private final UserFieldUpdateParser updateParser;

    public ProfileController(AuthService authService, UserFieldUpdateParser updateParser) {
        this.authService = authService;
        this.updateParser = updateParser;
    }

    @GetMapping
    public ResponseEntity<UserProfileResponse> currentUser(@AuthenticationPrincipal JwtAuthenticationPrincipal principal) {
        return ResponseEntity.ok(authService.loadProfile(principal.userId()));
    }

    @PutMapping
    public ResponseEntity<UserProfileResponse> updateProfile(
            @AuthenticationPrincipal JwtAuthenticationPrincipal principal,
            @RequestBody JsonNode body
    ) {
        return ResponseEntity.ok(authService.updateProfile(principal.userId(), updateParser.parseSelfService(body)));
    }
}
