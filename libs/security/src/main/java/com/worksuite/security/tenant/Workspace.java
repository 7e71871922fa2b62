package com.worksuite.security.tenant;

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * A tenant: one project-management context bound to one business project.
 *
 * @param id workspace id
 * @param name display name
 * @param ownerId user that owns the workspace
 * @param planType commercial plan
 * @param status administrative status
 * @param trialEndsAt end of the free trial, {@code null} for legacy workspaces
 * @param subscriptionId payment-provider subscription reference, {@code null} when unpaid
 * @param active soft-delete flag; {@code false} means deleted
 * @param projectId bound business project, {@code null} if never bound
 */
public record Workspace(
        long id,
        String name,
        long ownerId,
        PlanType planType,
        WorkspaceStatus status,
        Instant trialEndsAt,
        String subscriptionId,
        boolean active,
        Long projectId) {

    public Workspace {
        Objects.requireNonNull(planType, "planType");
        Objects.requireNonNull(status, "status");
    }

    public boolean isOwnedBy(long userId) {
        return ownerId == userId;
    }

    /** Active status and not soft-deleted. */
    public boolean isUsable() {
        return active && status == WorkspaceStatus.ACTIVE;
    }

    public boolean hasSubscription() {
        return subscriptionId != null && !subscriptionId.isBlank();
    }

    public Optional<Instant> trialEnd() {
        return Optional.ofNullable(trialEndsAt);
    }
}
