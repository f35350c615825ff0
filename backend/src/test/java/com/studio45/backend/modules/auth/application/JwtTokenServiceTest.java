package com.studio45.backend.modules.auth.application;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Date;
import java.util.UUID;

import com.studio45.backend.modules.auth.application.JwtTokenService.InvalidTokenException;
import com.studio45.backend.modules.auth.application.JwtTokenService.IssuedToken;
import com.studio45.backend.modules.auth.application.JwtTokenService.VerifiedToken;
import com.studio45.backend.modules.auth.infrastructure.jwt.JwtTokenProvider;

import io.jsonwebtoken.Claims;
import io.jsonwebtoken.Jwts;
import org.junit.jupiter.api.Test;

class JwtTokenServiceTest {

    private static final String SECRET = "unit-test-secret-key-0123456789abcdef";
    private static final Instant NOW = Instant.parse("2024-05-01T10:00:00Z");

    private final JwtTokenProvider provider = new JwtTokenProvider(SECRET);
    private final JwtTokenService service = serviceAt(NOW);

    @Test
    void issuedTokenCarriesOnlyIdentityAndTimestamps() {
        UUID userId = UUID.randomUUID();

        IssuedToken issued = service.issue(userId, "alice@example.com");

        Claims claims = Jwts.parser()
                .verifyWith(provider.getSecretKey())
                .clock(() -> Date.from(NOW))
                .build()
                .parseSignedClaims(issued.token())
                .getPayload();
        assertThat(claims.keySet()).containsExactlyInAnyOrder("sub", "email", "iat", "nbf", "exp");
        assertThat(claims.getSubject()).isEqualTo(userId.toString());
        assertThat(claims.getExpiration().toInstant()).isEqualTo(NOW.plus(Duration.ofHours(1)));
        assertThat(issued.expiresAt()).isEqualTo(NOW.plus(Duration.ofHours(1)));
    }

    @Test
    void verifyReturnsSubjectAndEmail() {
        UUID userId = UUID.randomUUID();
        String token = service.issue(userId, "alice@example.com").token();

        VerifiedToken verified = service.verify(token);

        assertThat(verified.userId()).isEqualTo(userId);
        assertThat(verified.email()).isEqualTo("alice@example.com");
    }

    @Test
    void expiredTokenIsRejected() {
        String token = service.issue(UUID.randomUUID(), "alice@example.com").token();
        JwtTokenService later = serviceAt(NOW.plus(Duration.ofHours(2)));

        assertThatThrownBy(() -> later.verify(token)).isInstanceOf(InvalidTokenException.class);
    }

    @Test
    void tamperedPayloadIsRejected() {
        String mine = service.issue(UUID.randomUUID(), "alice@example.com").token();
        String theirs = service.issue(UUID.randomUUID(), "bob@example.com").token();
        String[] mineParts = mine.split("\\.");
        String[] theirParts = theirs.split("\\.");
        String spliced = mineParts[0] + "." + theirParts[1] + "." + mineParts[2];

        assertThatThrownBy(() -> service.verify(spliced)).isInstanceOf(InvalidTokenException.class);
    }

    @Test
    void tokenSignedWithAnotherKeyIsRejected() {
        JwtTokenService foreign = new JwtTokenService(
                new JwtTokenProvider("another-secret-key-0123456789abcdefgh"),
                Duration.ofHours(1),
                Clock.fixed(NOW, ZoneOffset.UTC)
        );
        String token = foreign.issue(UUID.randomUUID(), "alice@example.com").token();

        assertThatThrownBy(() -> service.verify(token)).isInstanceOf(InvalidTokenException.class);
    }

    @Test
    void blankOrMalformedTokensAreRejected() {
        assertThatThrownBy(() -> service.verify("")).isInstanceOf(InvalidTokenException.class);
        assertThatThrownBy(() -> service.verify("not-a-jwt")).isInstanceOf(InvalidTokenException.class);
    }

    private JwtTokenService serviceAt(Instant instant) {
        return new JwtTokenService(provider, Duration.ofHours(1), Clock.fixed(instant, ZoneOffset.UTC));
    }
}
