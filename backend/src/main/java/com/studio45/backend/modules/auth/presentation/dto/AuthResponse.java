package com.studio45.backend.modules.auth.presentation.dto;

import java.time.Instant;

public record AuthResponse(
        String token,
        Instant expiresAt,
        UserSummary user
) {
}
