package com.worksuite.security.identity;

import java.util.Optional;

/**
 * Authenticated user record, loaded once per request and never mutated afterwards.
 * <p>
 * The optional columns ({@code tenantId}, {@code superAdmin}, {@code emailVerified}, {@code
 * clientId}) may be absent on partially-migrated schemas; they then read as {@code null} / {@code
 * false}.
 *
 * @param id user id
 * @param username login name
 * @param email email address
 * @param displayName full name
 * @param active whether the account may authenticate
 * @param legacyRole single role label stored on the user row (e.g. "admin", "viewer")
 * @param tenantId explicit workspace id, or {@code null}
 * @param superAdmin platform super-admin flag
 * @param emailVerified verification flag, or {@code null} when the column is absent
 * @param clientId business client the user represents, or {@code null}
 */
public record Identity(
        long id,
        String username,
        String email,
        String displayName,
        boolean active,
        String legacyRole,
        Long tenantId,
        boolean superAdmin,
        Boolean emailVerified,
        Long clientId) {

    public Optional<Long> tenant() {
        return Optional.ofNullable(tenantId);
    }

    public Optional<Long> client() {
        return Optional.ofNullable(clientId);
    }

    /** Copy of this identity bound to the workspace resolved for the current request. */
    public Identity withTenantId(Long workspaceId) {
        return new Identity(
                id,
                username,
                email,
                displayName,
                active,
                legacyRole,
                workspaceId,
                superAdmin,
                emailVerified,
                clientId);
    }
}
