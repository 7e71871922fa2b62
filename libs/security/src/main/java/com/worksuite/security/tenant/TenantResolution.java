package com.worksuite.security.tenant;

import java.util.Objects;
import java.util.Optional;

/**
 * Workspace context resolved for a request.
 *
 * @param workspace resolved workspace, {@code null} for no tenant or super-admin
 * @param role caller's effective tier in that workspace, {@code null} when no workspace
 * @param source how the workspace was found
 */
public record TenantResolution(Workspace workspace, WorkspaceRole role, Source source) {

    public enum Source {
        /** Platform super-admin, no tenant scope. */
        SUPER_ADMIN,
        /** Tenant id stored on the user row. */
        IDENTITY,
        /** Workspace claim carried by the credential. */
        CREDENTIAL_HINT,
        /** Most recently joined active membership. */
        MEMBERSHIP,
        /** Nothing resolved. */
        NONE
    }

    private static final TenantResolution NONE_RESOLVED = new TenantResolution(null, null, Source.NONE);
    private static final TenantResolution SUPER_ADMIN_SCOPE =
            new TenantResolution(null, null, Source.SUPER_ADMIN);

    public TenantResolution {
        Objects.requireNonNull(source, "source");
        if (workspace == null && role != null) {
            throw new IllegalArgumentException("role requires a workspace");
        }
    }

    public static TenantResolution none() {
        return NONE_RESOLVED;
    }

    public static TenantResolution superAdmin() {
        return SUPER_ADMIN_SCOPE;
    }

    public Optional<Workspace> resolved() {
        return Optional.ofNullable(workspace);
    }

    public Long workspaceId() {
        return workspace == null ? null : workspace.id();
    }
}
