package com.worksuite.security.testing;

import com.worksuite.security.tenant.MembershipStatus;
import com.worksuite.security.tenant.Workspace;
import com.worksuite.security.tenant.WorkspaceMembership;
import com.worksuite.security.tenant.WorkspaceRole;
import com.worksuite.security.tenant.WorkspaceStore;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Workspaces, memberships and project availability held in memory.
 */
public class InMemoryWorkspaceStore implements WorkspaceStore {

    private final Map<Long, Workspace> workspaces = new ConcurrentHashMap<>();
    private final List<WorkspaceMembership> memberships = new CopyOnWriteArrayList<>();
    private final Set<Long> removedProjects = ConcurrentHashMap.newKeySet();

    public InMemoryWorkspaceStore add(Workspace workspace) {
        workspaces.put(workspace.id(), workspace);
        return this;
    }

    public InMemoryWorkspaceStore addMember(long workspaceId, long userId, WorkspaceRole role, Instant joinedAt) {
        return addMembership(new WorkspaceMembership(workspaceId, userId, role, joinedAt, MembershipStatus.ACTIVE));
    }

    public InMemoryWorkspaceStore addMembership(WorkspaceMembership membership) {
        memberships.add(membership);
        return this;
    }

    /** Marks a project as deleted so workspaces bound to it become unavailable for mutations. */
    public InMemoryWorkspaceStore removeProject(long projectId) {
        removedProjects.add(projectId);
        return this;
    }

    @Override
    public Optional<Workspace> findById(long workspaceId) {
        return Optional.ofNullable(workspaces.get(workspaceId));
    }

    @Override
    public Optional<WorkspaceMembership> findActiveMembership(long workspaceId, long userId) {
        return memberships.stream()
                .filter(m -> m.workspaceId() == workspaceId && m.userId() == userId && m.isActive())
                .max(Comparator.comparing(WorkspaceMembership::joinedAt));
    }

    @Override
    public Optional<WorkspaceMembership> findLatestActiveMembership(long userId) {
        return memberships.stream()
                .filter(m -> m.userId() == userId && m.isActive())
                .filter(m -> findById(m.workspaceId()).filter(Workspace::isUsable).isPresent())
                .max(Comparator.comparing(WorkspaceMembership::joinedAt));
    }

    @Override
    public boolean isProjectAvailable(long projectId) {
        return !removedProjects.contains(projectId);
    }
}
