package com.worksuite.accessservice.api;

import com.worksuite.security.AccessDecision;
import com.worksuite.security.AuthorizationContext;
import com.worksuite.security.identity.Identity;
import com.worksuite.security.rbac.Permission;

import java.util.List;

/**
 * The caller's authorization context as returned by {@code GET /api/v1/auth/me}.
 *
 * @param userId user id
 * @param username login name
 * @param email email address
 * @param role legacy role label
 * @param workspaceId resolved workspace, {@code null} when none
 * @param workspaceRole tier in that workspace, {@code null} when none
 * @param superAdmin platform super-admin flag
 * @param allAccess holds the protected all-access role
 * @param permissions granted permissions as {@code module.action}, sorted
 * @param subscription trial state of the resolved workspace
 */
public record MeResponse(
        long userId,
        String username,
        String email,
        String role,
        Long workspaceId,
        String workspaceRole,
        boolean superAdmin,
        boolean allAccess,
        List<String> permissions,
        SubscriptionView subscription) {

    /**
     * @param active whether mutations are allowed by the subscription gate
     * @param reason denial code, {@code null} when active
     * @param trialEndsAt end of the lapsed trial, {@code null} otherwise
     */
    public record SubscriptionView(boolean active, String reason, String trialEndsAt) {

        static SubscriptionView of(AccessDecision decision) {
            if (decision.allowed()) {
                return new SubscriptionView(true, null, null);
            }
            return new SubscriptionView(
                    false,
                    decision.reason().value(),
                    decision.trialEndsAt() == null ? null : decision.trialEndsAt().toString());
        }
    }

    public static MeResponse from(AuthorizationContext context) {
        Identity identity = context.identity();
        return new MeResponse(
                identity.id(),
                identity.username(),
                identity.email(),
                identity.legacyRole(),
                context.workspaceId(),
                context.workspaceRole() == null ? null : context.workspaceRole().value(),
                context.superAdmin(),
                context.allAccess(),
                context.permissions().stream().map(Permission::toString).toList(),
                SubscriptionView.of(context.subscription()));
    }
}
