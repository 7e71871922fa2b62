package com.worksuite.database.jdbc;

import com.worksuite.security.rbac.PermissionRecord;
import com.worksuite.security.rbac.PermissionStore;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;

import java.util.Collection;
import java.util.List;

/**
 * Reads the union of permissions granted through role assignments.
 * <p>
 * Rows come back raw; unknown module or action values are filtered by the resolver.
 */
public class JdbcPermissionStore implements PermissionStore {

    private static final String SELECT_BY_ROLES =
            "SELECT DISTINCT p.id, p.module, p.action, p.description"
                    + " FROM permissions p"
                    + " JOIN role_permissions rp ON rp.permission_id = p.id"
                    + " WHERE rp.role_id IN (:roleIds)"
                    + " ORDER BY p.module, p.action";

    private final NamedParameterJdbcTemplate namedTemplate;

    public JdbcPermissionStore(JdbcTemplate jdbcTemplate) {
        this.namedTemplate = new NamedParameterJdbcTemplate(jdbcTemplate);
    }

    @Override
    public List<PermissionRecord> findByRoleIds(Collection<Long> roleIds) {
        if (roleIds.isEmpty()) {
            return List.of();
        }
        return namedTemplate.query(
                SELECT_BY_ROLES,
                new MapSqlParameterSource("roleIds", roleIds),
                (rs, rowNum) ->
                        new PermissionRecord(
                                rs.getLong("id"),
                                rs.getString("module"),
                                rs.getString("action"),
                                rs.getString("description")));
    }
}
