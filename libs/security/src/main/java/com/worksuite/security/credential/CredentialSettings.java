package com.worksuite.security.credential;

import io.jsonwebtoken.security.Keys;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import javax.crypto.SecretKey;

/**
 * Immutable signing configuration for bearer credentials, built once at startup and injected into
 * {@link CredentialVerifier} and {@link TokenIssuer}.
 *
 * @param secret HMAC secret; at least 32 bytes once UTF-8 encoded (HS256 key size)
 * @param issuer value written to and required in the {@code iss} claim
 * @param tokenExpiry lifetime of newly issued credentials
 */
public record CredentialSettings(String secret, String issuer, Duration tokenExpiry) {

    /** Default credential lifetime. */
    public static final Duration DEFAULT_EXPIRY = Duration.ofDays(7);

    /** Default issuer claim. */
    public static final String DEFAULT_ISSUER = "worksuite";

    private static final int MIN_SECRET_BYTES = 32;

    public CredentialSettings {
        if (secret == null || secret.getBytes(StandardCharsets.UTF_8).length < MIN_SECRET_BYTES) {
            throw new IllegalArgumentException(
                    "JWT secret must be at least %d bytes".formatted(MIN_SECRET_BYTES));
        }
        if (issuer == null || issuer.isBlank()) {
            issuer = DEFAULT_ISSUER;
        }
        if (tokenExpiry == null) {
            tokenExpiry = DEFAULT_EXPIRY;
        }
        if (tokenExpiry.isNegative() || tokenExpiry.isZero()) {
            throw new IllegalArgumentException("tokenExpiry must be positive");
        }
    }

    public static CredentialSettings withDefaults(String secret) {
        return new CredentialSettings(secret, DEFAULT_ISSUER, DEFAULT_EXPIRY);
    }

    SecretKey signingKey() {
        return Keys.hmacShaKeyFor(secret.getBytes(StandardCharsets.UTF_8));
    }

    @Override
    public String toString() {
        return "CredentialSettings[issuer=" + issuer + ", tokenExpiry=" + tokenExpiry + "]";
    }
}
