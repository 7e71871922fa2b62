package com.worksuite.database.jdbc;

import com.worksuite.security.identity.Identity;
import com.worksuite.security.identity.IdentityStore;
import com.worksuite.security.identity.SchemaCapabilities;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.Optional;
import java.util.StringJoiner;

/**
 * Loads users, selecting only the optional columns the schema is known to have.
 */
public class JdbcIdentityStore implements IdentityStore {

    private final JdbcTemplate jdbcTemplate;
    private final SchemaCapabilities capabilities;
    private final String selectById;

    public JdbcIdentityStore(JdbcTemplate jdbcTemplate, SchemaCapabilities capabilities) {
        this.jdbcTemplate = jdbcTemplate;
        this.capabilities = capabilities;
        this.selectById = buildSelect(capabilities);
    }

    @Override
    public Optional<Identity> findById(long userId) {
        return jdbcTemplate.query(selectById, new IdentityRowMapper(), userId).stream().findFirst();
    }

    String selectSql() {
        return selectById;
    }

    private static String buildSelect(SchemaCapabilities capabilities) {
        StringJoiner columns = new StringJoiner(", ");
        columns.add("id").add("username").add("email").add("full_name").add("is_active").add("role");
        if (capabilities.tenantColumn()) {
            columns.add("workspace_id");
        }
        if (capabilities.superAdminColumn()) {
            columns.add("is_super_admin");
        }
        if (capabilities.emailVerifiedColumn()) {
            columns.add("email_verified");
        }
        if (capabilities.clientColumn()) {
            columns.add("client_id");
        }
        return "SELECT " + columns + " FROM users WHERE id = ?";
    }

    private final class IdentityRowMapper implements RowMapper<Identity> {

        @Override
        public Identity mapRow(ResultSet rs, int rowNum) throws SQLException {
            Long tenantId =
                    capabilities.tenantColumn() ? JdbcColumns.nullableLong(rs, "workspace_id") : null;
            boolean superAdmin = capabilities.superAdminColumn() && rs.getBoolean("is_super_admin");
            Boolean emailVerified =
                    capabilities.emailVerifiedColumn()
                            ? JdbcColumns.nullableBoolean(rs, "email_verified")
                            : null;
            Long clientId =
                    capabilities.clientColumn() ? JdbcColumns.nullableLong(rs, "client_id") : null;
            return new Identity(
                    rs.getLong("id"),
                    rs.getString("username"),
                    rs.getString("email"),
                    rs.getString("full_name"),
                    rs.getBoolean("is_active"),
                    rs.getString("role"),
                    tenantId,
                    superAdmin,
                    emailVerified,
                    clientId);
        }
    }
}
