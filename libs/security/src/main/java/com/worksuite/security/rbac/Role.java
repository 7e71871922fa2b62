package com.worksuite.security.rbac;

import java.util.Objects;

/**
 * A named role from the {@code roles} table.
 *
 * @param id role id
 * @param name unique machine name (e.g. "admin", "viewer")
 * @param displayName human-readable name
 * @param systemRole whether the role ships with the platform
 */
public record Role(long id, String name, String displayName, boolean systemRole) {

    /** Name of the role that grants all-access and can never be modified. */
    public static final String PROTECTED_ROLE_NAME = "admin";

    public Role {
        Objects.requireNonNull(name, "name");
    }

    /** Whether this is the protected super-admin role. */
    public boolean isProtected() {
        return PROTECTED_ROLE_NAME.equals(name);
    }
}
