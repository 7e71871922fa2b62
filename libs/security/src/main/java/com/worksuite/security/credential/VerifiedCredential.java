package com.worksuite.security.credential;

import java.time.Instant;
import java.util.Optional;

/**
 * Claims extracted from a bearer credential whose signature, issuer and expiry were verified.
 *
 * @param subjectId user id from the {@code sub} claim
 * @param tenantHint workspace id embedded at issuance, or {@code null}
 * @param issuedAt issuance time
 * @param expiresAt expiry time
 */
public record VerifiedCredential(
        long subjectId, Long tenantHint, Instant issuedAt, Instant expiresAt) {

    public Optional<Long> tenant() {
        return Optional.ofNullable(tenantHint);
    }
}
