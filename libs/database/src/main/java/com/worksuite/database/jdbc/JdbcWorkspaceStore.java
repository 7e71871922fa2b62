package com.worksuite.database.jdbc;

import com.worksuite.security.tenant.MembershipStatus;
import com.worksuite.security.tenant.PlanType;
import com.worksuite.security.tenant.Workspace;
import com.worksuite.security.tenant.WorkspaceMembership;
import com.worksuite.security.tenant.WorkspaceRole;
import com.worksuite.security.tenant.WorkspaceStatus;
import com.worksuite.security.tenant.WorkspaceStore;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;

import java.util.Optional;

/**
 * Workspaces, memberships and project availability.
 * <p>
 * Unknown stored enum values degrade to the restrictive reading (free plan, suspended workspace,
 * inactive membership, member tier) rather than failing the request.
 */
public class JdbcWorkspaceStore implements WorkspaceStore {

    private static final String SELECT_WORKSPACE =
            "SELECT id, name, owner_id, plan_type, status, trial_ends_at, subscription_id,"
                    + " is_active, project_id FROM workspaces WHERE id = ?";

    private static final String SELECT_ACTIVE_MEMBERSHIP =
            "SELECT workspace_id, user_id, role, joined_at, status FROM workspace_members"
                    + " WHERE workspace_id = ? AND user_id = ? AND status = 'active'";

    private static final String SELECT_LATEST_MEMBERSHIP =
            "SELECT m.workspace_id, m.user_id, m.role, m.joined_at, m.status"
                    + " FROM workspace_members m JOIN workspaces w ON w.id = m.workspace_id"
                    + " WHERE m.user_id = ? AND m.status = 'active'"
                    + " AND w.status = 'active' AND w.is_active = TRUE"
                    + " ORDER BY m.joined_at DESC, m.id DESC LIMIT 1";

    private static final String COUNT_AVAILABLE_PROJECT =
            "SELECT COUNT(*) FROM projects WHERE id = ? AND deleted_at IS NULL";

    private static final RowMapper<Workspace> WORKSPACE_MAPPER =
            (rs, rowNum) ->
                    new Workspace(
                            rs.getLong("id"),
                            rs.getString("name"),
                            rs.getLong("owner_id"),
                            PlanType.fromValue(rs.getString("plan_type")),
                            WorkspaceStatus.fromValue(rs.getString("status")),
                            JdbcColumns.nullableInstant(rs, "trial_ends_at"),
                            rs.getString("subscription_id"),
                            rs.getBoolean("is_active"),
                            JdbcColumns.nullableLong(rs, "project_id"));

    private static final RowMapper<WorkspaceMembership> MEMBERSHIP_MAPPER =
            (rs, rowNum) ->
                    new WorkspaceMembership(
                            rs.getLong("workspace_id"),
                            rs.getLong("user_id"),
                            WorkspaceRole.fromLabel(rs.getString("role")).orElse(WorkspaceRole.MEMBER),
                            JdbcColumns.nullableInstant(rs, "joined_at"),
                            MembershipStatus.fromValue(rs.getString("status")));

    private final JdbcTemplate jdbcTemplate;

    public JdbcWorkspaceStore(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Override
    public Optional<Workspace> findById(long workspaceId) {
        return jdbcTemplate.query(SELECT_WORKSPACE, WORKSPACE_MAPPER, workspaceId).stream().findFirst();
    }

    @Override
    public Optional<WorkspaceMembership> findActiveMembership(long workspaceId, long userId) {
        return jdbcTemplate
                .query(SELECT_ACTIVE_MEMBERSHIP, MEMBERSHIP_MAPPER, workspaceId, userId)
                .stream()
                .findFirst();
    }

    @Override
    public Optional<WorkspaceMembership> findLatestActiveMembership(long userId) {
        return jdbcTemplate.query(SELECT_LATEST_MEMBERSHIP, MEMBERSHIP_MAPPER, userId).stream().findFirst();
    }

    @Override
    public boolean isProjectAvailable(long projectId) {
        Integer count = jdbcTemplate.queryForObject(COUNT_AVAILABLE_PROJECT, Integer.class, projectId);
        return count != null && count > 0;
    }
}
