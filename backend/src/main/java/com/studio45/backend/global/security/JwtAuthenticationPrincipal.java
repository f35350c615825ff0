package com.studio45.backend.global.security;

import java.util.List;
import java.util.UUID;

/**
 * Authenticated caller. Roles are resolved from the catalog for the current request, never read from the token.
 */
public record JwtAuthenticationPrincipal(UUID userId, String email, List<String> roles) {

    public JwtAuthenticationPrincipal {
        roles = roles == null ? List.of() : List.copyOf(roles);
    }
}
