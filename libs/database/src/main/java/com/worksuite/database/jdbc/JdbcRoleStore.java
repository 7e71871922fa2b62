package com.worksuite.database.jdbc;

import com.worksuite.security.rbac.Role;
import com.worksuite.security.rbac.RoleStore;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;

import java.util.List;
import java.util.Optional;

public class JdbcRoleStore implements RoleStore {

    private static final String ROLE_COLUMNS = "r.id, r.name, r.display_name, r.is_system_role";

    private static final RowMapper<Role> ROLE_MAPPER =
            (rs, rowNum) ->
                    new Role(
                            rs.getLong("id"),
                            rs.getString("name"),
                            rs.getString("display_name"),
                            rs.getBoolean("is_system_role"));

    private final JdbcTemplate jdbcTemplate;

    public JdbcRoleStore(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Override
    public List<Role> findAssignedRoles(long userId) {
        String sql =
                "SELECT "
                        + ROLE_COLUMNS
                        + " FROM roles r JOIN user_roles ur ON ur.role_id = r.id"
                        + " WHERE ur.user_id = ? ORDER BY r.id";
        return jdbcTemplate.query(sql, ROLE_MAPPER, userId);
    }

    @Override
    public Optional<Role> findByName(String name) {
        String sql = "SELECT " + ROLE_COLUMNS + " FROM roles r WHERE r.name = ?";
        return jdbcTemplate.query(sql, ROLE_MAPPER, name).stream().findFirst();
    }

    @Override
    public Optional<Role> findById(long roleId) {
        String sql = "SELECT " + ROLE_COLUMNS + " FROM roles r WHERE r.id = ?";
        return jdbcTemplate.query(sql, ROLE_MAPPER, roleId).stream().findFirst();
    }
}
