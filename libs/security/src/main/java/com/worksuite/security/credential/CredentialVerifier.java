package com.worksuite.security.credential;

import com.worksuite.security.AuthenticationException;
import com.worksuite.security.FailureCode;
import io.jsonwebtoken.Claims;
import io.jsonwebtoken.ExpiredJwtException;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.JwtParser;
import io.jsonwebtoken.Jwts;

import java.time.Clock;
import java.time.Instant;
import java.util.Date;

/**
 * Verifies bearer credentials issued by {@link TokenIssuer}.
 * <p>
 * A credential with a valid signature whose expiry has passed fails with {@link
 * FailureCode#CREDENTIAL_EXPIRED}; everything else that cannot be trusted (malformed, bad
 * signature, wrong issuer, non-numeric subject) fails with {@link FailureCode#INVALID_CREDENTIAL}.
 * Both are authentication failures, never authorization failures.
 */
public class CredentialVerifier {

    private final JwtParser parser;

    public CredentialVerifier(CredentialSettings settings, Clock clock) {
        this.parser =
                Jwts.parser()
                        .verifyWith(settings.signingKey())
                        .requireIssuer(settings.issuer())
                        .clock(() -> Date.from(clock.instant()))
                        .build();
    }

    /**
     * Verifies the token and extracts its subject and tenant hint.
     *
     * @param token compact JWS string (without the {@code Bearer} prefix)
     * @return verified claims
     * @throws AuthenticationException with {@code INVALID_CREDENTIAL} or {@code CREDENTIAL_EXPIRED}
     */
    public VerifiedCredential verify(String token) {
        if (token == null || token.isBlank()) {
            throw new AuthenticationException(FailureCode.MISSING_CREDENTIAL);
        }
        Claims claims;
        try {
            claims = parser.parseSignedClaims(token).getPayload();
        } catch (ExpiredJwtException e) {
            throw new AuthenticationException(
                    FailureCode.CREDENTIAL_EXPIRED, FailureCode.CREDENTIAL_EXPIRED.defaultMessage(), e);
        } catch (JwtException | IllegalArgumentException e) {
            throw new AuthenticationException(
                    FailureCode.INVALID_CREDENTIAL, FailureCode.INVALID_CREDENTIAL.defaultMessage(), e);
        }

        long subjectId = parseSubject(claims.getSubject());
        Long tenantHint = toLong(claims.get(TokenIssuer.CLAIM_WORKSPACE_ID));
        return new VerifiedCredential(
                subjectId, tenantHint, toInstant(claims.getIssuedAt()), toInstant(claims.getExpiration()));
    }

    private static long parseSubject(String subject) {
        if (subject == null || subject.isBlank()) {
            throw new AuthenticationException(FailureCode.INVALID_CREDENTIAL, "Token has no subject");
        }
        try {
            return Long.parseLong(subject);
        } catch (NumberFormatException e) {
            throw new AuthenticationException(
                    FailureCode.INVALID_CREDENTIAL, "Token subject is not a user id", e);
        }
    }

    private static Long toLong(Object claim) {
        if (claim instanceof Number number) {
            return number.longValue();
        }
        if (claim instanceof String text && !text.isBlank()) {
            try {
                return Long.parseLong(text);
            } catch (NumberFormatException e) {
                throw new AuthenticationException(
                        FailureCode.INVALID_CREDENTIAL, "Token workspace claim is malformed", e);
            }
        }
        return null;
    }

    private static Instant toInstant(Date date) {
        return date == null ? null : date.toInstant();
    }
}
