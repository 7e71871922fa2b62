package com.worksuite.security.tenant;

import java.util.Optional;

/**
 * Read access to workspaces, memberships and the projects they are bound to.
 */
public interface WorkspaceStore {

    /** Workspace by id, including soft-deleted and inactive ones. */
    Optional<Workspace> findById(long workspaceId);

    /** The user's active membership in the workspace, if any. */
    Optional<WorkspaceMembership> findActiveMembership(long workspaceId, long userId);

    /**
     * The user's most recently joined active membership in a workspace whose status is active
     * and which is not soft-deleted.
     */
    Optional<WorkspaceMembership> findLatestActiveMembership(long userId);

    /** Whether the project exists and is not soft-deleted. */
    boolean isProjectAvailable(long projectId);
}
