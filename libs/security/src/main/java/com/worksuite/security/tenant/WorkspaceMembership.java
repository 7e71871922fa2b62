package com.worksuite.security.tenant;

import java.time.Instant;

/**
 * A user's membership row in a workspace.
 *
 * @param workspaceId workspace
 * @param userId member
 * @param role tier inside the workspace
 * @param joinedAt join time, used to pick the most recent membership
 * @param status membership lifecycle status
 */
public record WorkspaceMembership(
        long workspaceId, long userId, WorkspaceRole role, Instant joinedAt, MembershipStatus status) {

    public boolean isActive() {
        return status == MembershipStatus.ACTIVE;
    }
}
