package com.studio45.backend.modules.auth.infrastructure.jwt;

import java.nio.charset.StandardCharsets;
import java.util.Base64;

import javax.crypto.SecretKey;
import javax.crypto.spec.SecretKeySpec;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * HMAC signing key built from {@code jwt.secret}. A {@code base64:} prefix marks an encoded key,
 * anything else is used as raw UTF-8 bytes.
 */
@Component
public class JwtTokenProvider {

    static final String BASE64_PREFIX = "base64:";
    static final String PLACEHOLDER_SECRET = "your-secret-key-change-this-in-production";
    private static final String HMAC_SHA_256 = "HmacSHA256";
    private static final int MIN_KEY_BYTES = 32;

    private final SecretKey secretKey;

    public JwtTokenProvider(@Value("${jwt.secret:}") String secret) {
        this.secretKey = new SecretKeySpec(decode(secret), HMAC_SHA_256);
    }

    public SecretKey getSecretKey() {
        return secretKey;
    }

    static byte[] decode(String secret) {
        if (secret == null || secret.isBlank()) {
            throw new IllegalStateException("jwt.secret is not configured");
        }
        if (PLACEHOLDER_SECRET.equals(secret)) {
            throw new IllegalStateException("jwt.secret still holds the placeholder value");
        }
        byte[] keyBytes;
        if (secret.startsWith(BASE64_PREFIX)) {
            try {
                keyBytes = Base64.getDecoder().decode(secret.substring(BASE64_PREFIX.length()));
            } catch (IllegalArgumentException ex) {
                throw new IllegalStateException("jwt.secret is not valid base64", ex);
            }
        } else {
            keyBytes = secret.getBytes(StandardCharsets.UTF_8);
        }
        if (keyBytes.length < MIN_KEY_BYTES) {
            throw new IllegalStateException("jwt.secret must be at least " + MIN_KEY_BYTES + " bytes for HS256");
        }
        return keyBytes;
    }
}
