package com.studio45.backend.modules.auth.application;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Date;
import java.util.UUID;

import com.studio45.backend.modules.auth.infrastructure.jwt.JwtTokenProvider;

import io.jsonwebtoken.Claims;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.Jwts.SIG;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/**
 * Issues and verifies session tokens. The payload carries the user id and email only;
 * roles are looked up on every request so changes apply without re-issuing tokens.
 */
@Service
public class JwtTokenService {

    static final String EMAIL_CLAIM = "email";

    private final JwtTokenProvider tokenProvider;
    private final Duration expiration;
    private final Clock clock;

    public JwtTokenService(
            JwtTokenProvider tokenProvider,
            @Value("${jwt.expiration:24h}") Duration expiration,
            Clock clock
    ) {
        this.tokenProvider = tokenProvider;
        this.expiration = expiration;
        this.clock = clock;
    }

    public IssuedToken issue(UUID userId, String email) {
        Instant now = clock.instant();
        Instant expiresAt = now.plus(expiration);

        String token = Jwts.builder()
                .subject(userId.toString())
                .claim(EMAIL_CLAIM, email)
                .issuedAt(Date.from(now))
                .notBefore(Date.from(now))
                .expiration(Date.from(expiresAt))
                .signWith(tokenProvider.getSecretKey(), SIG.HS256)
                .compact();

        return new IssuedToken(token, expiresAt);
    }

    public VerifiedToken verify(String token) {
        if (token == null || token.isBlank()) {
            throw new InvalidTokenException("Missing token", null);
        }
        try {
            Claims claims = Jwts.parser()
                    .verifyWith(tokenProvider.getSecretKey())
                    .clock(() -> Date.from(clock.instant()))
                    .build()
                    .parseSignedClaims(token)
                    .getPayload();

            if (claims.getSubject() == null || claims.getExpiration() == null) {
                throw new InvalidTokenException("Token is missing required claims", null);
            }
            UUID userId = UUID.fromString(claims.getSubject());
            String email = claims.get(EMAIL_CLAIM, String.class);
            return new VerifiedToken(userId, email, claims.getExpiration().toInstant());
        } catch (JwtException | IllegalArgumentException e) {
            throw new InvalidTokenException("Invalid or expired token", e);
        }
    }

    public Duration getExpiration() {
        return expiration;
    }

    public record IssuedToken(String token, Instant expiresAt) {
    }

    public record VerifiedToken(UUID userId, String email, Instant expiresAt) {
    }

    public static class InvalidTokenException extends RuntimeException {
        public InvalidTokenException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
