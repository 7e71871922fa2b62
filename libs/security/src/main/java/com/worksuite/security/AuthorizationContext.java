package com.worksuite.security;

import com.worksuite.security.identity.Identity;
import com.worksuite.security.rbac.LegacyRole;
import com.worksuite.security.rbac.Permission;
import com.worksuite.security.tenant.Workspace;
import com.worksuite.security.tenant.WorkspaceRole;

import java.util.Collections;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Everything the engine resolved about the caller of one request.
 * <p>
 * Built once by {@link AuthorizationEngine} after the credential is verified, then only read.
 * Collections are defensively copied and unmodifiable.
 *
 * @param identity the caller, bound to the resolved workspace id
 * @param roleIds resolved role ids
 * @param permissions permission grants ordered by (module, action)
 * @param workspace resolved tenant, {@code null} for super-admin or no tenant
 * @param workspaceRole caller's tier in {@code workspace}, {@code null} without one
 * @param superAdmin platform super-admin, exempt from tenant and permission checks
 * @param allAccess holds the protected all-access role (directly or via legacy label)
 * @param subscription trial/subscription verdict for {@code workspace}
 */
public record AuthorizationContext(
        Identity identity,
        Set<Long> roleIds,
        SortedSet<Permission> permissions,
        Workspace workspace,
        WorkspaceRole workspaceRole,
        boolean superAdmin,
        boolean allAccess,
        AccessDecision subscription) {

    public AuthorizationContext {
        Objects.requireNonNull(identity, "identity");
        roleIds = Set.copyOf(roleIds);
        permissions = Collections.unmodifiableSortedSet(new TreeSet<>(permissions));
        subscription = subscription == null ? AccessDecision.allow() : subscription;
    }

    public long userId() {
        return identity.id();
    }

    public Optional<Workspace> tenant() {
        return Optional.ofNullable(workspace);
    }

    public Long workspaceId() {
        return workspace == null ? null : workspace.id();
    }

    public Optional<LegacyRole> legacyRole() {
        return LegacyRole.fromLabel(identity.legacyRole());
    }

    public boolean hasPermission(Permission permission) {
        return permissions.contains(permission);
    }
}
