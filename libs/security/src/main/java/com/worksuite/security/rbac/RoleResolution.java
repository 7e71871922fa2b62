package com.worksuite.security.rbac;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Roles resolved for one user, with where they came from.
 * <p>
 * An empty role list is ambiguous on its own: {@link Source#NONE} means nothing is configured,
 * {@link Source#UNRESOLVED} means a legacy label is set but names no existing role.
 *
 * @param roles resolved roles, never null
 * @param source how the roles were resolved
 * @param legacyLabel label on the user row, kept for diagnostics (may be null)
 */
public record RoleResolution(List<Role> roles, Source source, String legacyLabel) {

    /** Resolution path. */
    public enum Source {
        /** Rows in the user-role assignment table. */
        EXPLICIT,
        /** No assignments; legacy label matched a role by name. */
        LEGACY_LABEL,
        /** No assignments; legacy label set but unknown. */
        UNRESOLVED,
        /** No assignments and no label. */
        NONE
    }

    public RoleResolution {
        roles = List.copyOf(roles);
        Objects.requireNonNull(source, "source");
    }

    public Set<Long> roleIds() {
        Set<Long> ids = new LinkedHashSet<>();
        for (Role role : roles) {
            ids.add(role.id());
        }
        return Set.copyOf(ids);
    }

    public boolean isEmpty() {
        return roles.isEmpty();
    }

    /** Whether any resolved role is the protected all-access role. */
    public boolean includesProtectedRole() {
        return roles.stream().anyMatch(Role::isProtected);
    }
}
