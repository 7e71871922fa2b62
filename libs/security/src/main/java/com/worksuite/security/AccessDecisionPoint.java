package com.worksuite.security;

import com.worksuite.security.rbac.Action;
import com.worksuite.security.rbac.LegacyRole;
import com.worksuite.security.rbac.Permission;
import com.worksuite.security.tenant.SubscriptionGate;
import com.worksuite.security.tenant.Workspace;
import com.worksuite.security.tenant.WorkspaceMembership;
import com.worksuite.security.tenant.WorkspaceRole;
import com.worksuite.security.tenant.WorkspaceStatus;
import com.worksuite.security.tenant.WorkspaceStore;

import java.util.Arrays;
import java.util.Optional;

/**
 * The single place request handlers ask "may this caller do that?".
 * <p>
 * Every check reads the {@link AuthorizationContext} (and, for workspace checks, the current
 * workspace rows) and returns an {@link AccessDecision}; nothing is thrown for a denial and
 * nothing is written. Handlers call {@link #requireWorkspaceAccess} before touching
 * workspace-scoped data and a permission check before any module-scoped action.
 */
public class AccessDecisionPoint {

    private final WorkspaceStore workspaces;
    private final SubscriptionGate subscriptionGate;

    public AccessDecisionPoint(WorkspaceStore workspaces, SubscriptionGate subscriptionGate) {
        this.workspaces = workspaces;
        this.subscriptionGate = subscriptionGate;
    }

    /**
     * Allowed iff the caller's legacy role label is one of {@code allowed}.
     */
    public AccessDecision requireRole(AuthorizationContext ctx, LegacyRole... allowed) {
        Optional<LegacyRole> role = ctx.legacyRole();
        if (role.isPresent() && Arrays.asList(allowed).contains(role.get())) {
            return AccessDecision.allow();
        }
        return AccessDecision.deny(FailureCode.ROLE_REQUIRED);
    }

    /**
     * Allowed for super-admins, holders of the all-access role, and callers granted the exact
     * permission.
     */
    public AccessDecision requirePermission(AuthorizationContext ctx, Permission permission) {
        if (bypassesPermissions(ctx) || ctx.hasPermission(permission)) {
            return AccessDecision.allow();
        }
        return AccessDecision.deny(FailureCode.PERMISSION_REQUIRED, "Insufficient permissions: " + permission);
    }

    /**
     * ALL-of: every listed permission must be granted. An empty list is allowed.
     */
    public AccessDecision requireAllPermissions(AuthorizationContext ctx, Permission... permissions) {
        if (bypassesPermissions(ctx)) {
            return AccessDecision.allow();
        }
        for (Permission permission : permissions) {
            if (!ctx.hasPermission(permission)) {
                return AccessDecision.deny(
                        FailureCode.PERMISSION_REQUIRED, "Insufficient permissions: " + permission);
            }
        }
        return AccessDecision.allow();
    }

    /**
     * ANY-of: at least one listed permission must be granted. An empty list is denied.
     */
    public AccessDecision requireAnyPermission(AuthorizationContext ctx, Permission... permissions) {
        if (bypassesPermissions(ctx)) {
            return AccessDecision.allow();
        }
        for (Permission permission : permissions) {
            if (ctx.hasPermission(permission)) {
                return AccessDecision.allow();
            }
        }
        if (permissions.length == 1) {
            return AccessDecision.deny(
                    FailureCode.PERMISSION_REQUIRED, "Insufficient permissions: " + permissions[0]);
        }
        return AccessDecision.deny(FailureCode.PERMISSION_REQUIRED);
    }

    /**
     * Checks the caller may use a workspace.
     * <p>
     * Super-admins pass for any id, existing or not. Otherwise the workspace must exist and not be
     * soft-deleted (else not-found), the caller must own it or hold an active membership (else
     * forbidden), and it must be in active status. Mutations additionally require the bound
     * project to still exist (else gone) and the subscription gate to pass.
     */
    public AccessDecision requireWorkspaceAccess(AuthorizationContext ctx, long workspaceId, AccessMode mode) {
        if (ctx.superAdmin()) {
            return AccessDecision.allow();
        }
        Optional<Workspace> found = workspaces.findById(workspaceId).filter(Workspace::active);
        if (found.isEmpty()) {
            return AccessDecision.deny(FailureCode.WORKSPACE_NOT_FOUND);
        }
        Workspace workspace = found.get();
        if (!workspace.isOwnedBy(ctx.userId())
                && workspaces.findActiveMembership(workspaceId, ctx.userId()).isEmpty()) {
            return AccessDecision.deny(FailureCode.WORKSPACE_ACCESS_DENIED);
        }
        if (workspace.status() != WorkspaceStatus.ACTIVE) {
            return AccessDecision.deny(FailureCode.WORKSPACE_INACTIVE);
        }
        if (mode == AccessMode.MUTATION) {
            if (workspace.projectId() != null && !workspaces.isProjectAvailable(workspace.projectId())) {
                return AccessDecision.deny(FailureCode.PROJECT_UNAVAILABLE);
            }
            return subscriptionGate.evaluate(workspace);
        }
        return AccessDecision.allow();
    }

    /**
     * Workspace access followed by a permission check that also honours the caller's tier inside
     * that workspace.
     * <p>
     * A global grant is enough unless the caller is only a workspace viewer, who may never do
     * more than view. Without a global grant, owners and admins may do anything, members
     * anything but delete, viewers only view.
     */
    public AccessDecision requireWorkspacePermission(
            AuthorizationContext ctx, long workspaceId, Permission permission, AccessMode mode) {
        AccessDecision access = requireWorkspaceAccess(ctx, workspaceId, mode);
        if (access.denied() || bypassesPermissions(ctx)) {
            return access;
        }
        WorkspaceRole tier = tierIn(ctx, workspaceId);
        boolean granted = ctx.hasPermission(permission)
                ? tier != WorkspaceRole.VIEWER || permission.action() == Action.VIEW
                : tier.permits(permission.action());
        if (granted) {
            return AccessDecision.allow();
        }
        return AccessDecision.deny(FailureCode.PERMISSION_REQUIRED, "Insufficient permissions: " + permission);
    }

    /**
     * Checks the caller may see data belonging to a business client.
     * <p>
     * Super-admins and staff labels see every client; the {@code client} label only its own
     * client; any other label is not client-scoped.
     */
    public AccessDecision requireClientAccess(AuthorizationContext ctx, long clientId) {
        if (ctx.superAdmin()) {
            return AccessDecision.allow();
        }
        Optional<LegacyRole> role = ctx.legacyRole();
        if (role.isPresent() && role.get() == LegacyRole.CLIENT) {
            Long own = ctx.identity().clientId();
            return own != null && own == clientId
                    ? AccessDecision.allow()
                    : AccessDecision.deny(FailureCode.CLIENT_ACCESS_DENIED);
        }
        return AccessDecision.allow();
    }

    /**
     * Checks the request has a tenant at all, for handlers that operate on "my workspace".
     * Mutations also require the resolved workspace to pass the subscription gate.
     */
    public AccessDecision requireTenant(AuthorizationContext ctx, AccessMode mode) {
        if (ctx.superAdmin()) {
            return AccessDecision.allow();
        }
        if (ctx.workspace() == null) {
            return AccessDecision.deny(FailureCode.NO_WORKSPACE);
        }
        return mode == AccessMode.MUTATION ? ctx.subscription() : AccessDecision.allow();
    }

    private static boolean bypassesPermissions(AuthorizationContext ctx) {
        return ctx.superAdmin() || ctx.allAccess();
    }

    private WorkspaceRole tierIn(AuthorizationContext ctx, long workspaceId) {
        if (ctx.workspace() != null && ctx.workspace().id() == workspaceId && ctx.workspaceRole() != null) {
            return ctx.workspaceRole();
        }
        return workspaces.findById(workspaceId)
                .filter(ws -> ws.isOwnedBy(ctx.userId()))
                .map(ws -> WorkspaceRole.OWNER)
                .orElseGet(() -> WorkspaceRole.effective(
                        ctx.identity().legacyRole(),
                        workspaces.findActiveMembership(workspaceId, ctx.userId())
                                .map(WorkspaceMembership::role)
                                .orElse(null)));
    }
}
