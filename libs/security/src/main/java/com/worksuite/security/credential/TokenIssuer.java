package com.worksuite.security.credential;

import io.jsonwebtoken.Jwts;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.Date;
import java.util.UUID;
import javax.crypto.SecretKey;

/**
 * Mints signed bearer credentials. The only place the engine creates, rather than consumes, a
 * credential.
 * <p>
 * Every call produces a distinct token (random {@code jti}), so callers must not retry it blindly.
 */
public class TokenIssuer {

    private static final Logger log = LoggerFactory.getLogger(TokenIssuer.class);

    static final String CLAIM_WORKSPACE_ID = "workspaceId";

    private final CredentialSettings settings;
    private final SecretKey key;
    private final Clock clock;

    public TokenIssuer(CredentialSettings settings, Clock clock) {
        this.settings = settings;
        this.key = settings.signingKey();
        this.clock = clock;
    }

    /**
     * Issues a credential for the given user.
     *
     * @param userId authenticated user id (becomes {@code sub})
     * @param workspaceId tenant to embed as a hint, or {@code null}
     * @return compact JWS string
     */
    public String generateToken(long userId, Long workspaceId) {
        Instant now = clock.instant();
        Instant expiresAt = now.plus(settings.tokenExpiry());

        var builder =
                Jwts.builder()
                        .id(UUID.randomUUID().toString())
                        .subject(Long.toString(userId))
                        .issuer(settings.issuer())
                        .issuedAt(Date.from(now))
                        .expiration(Date.from(expiresAt));
        if (workspaceId != null) {
            builder.claim(CLAIM_WORKSPACE_ID, workspaceId);
        }
        String token = builder.signWith(key, Jwts.SIG.HS256).compact();
        log.debug("Issued credential for user {} (workspace {}), expires {}", userId, workspaceId, expiresAt);
        return token;
    }
}
