package com.worksuite.database.jdbc;

import com.worksuite.security.identity.SchemaCapabilities;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.DatabaseMetaData;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.HashSet;
import java.util.Locale;
import java.util.Set;
import javax.sql.DataSource;

/**
 * Detects which optional tenancy columns exist on the {@code users} table.
 * <p>
 * Runs once at startup. A database that stopped at the single-tenant migrations yields
 * {@link SchemaCapabilities#legacy()}; the engine then loads reduced identities instead of failing.
 */
public class SchemaCapabilityProbe {

    private static final Logger log = LoggerFactory.getLogger(SchemaCapabilityProbe.class);

    static final String USERS_TABLE = "users";

    private final DataSource dataSource;

    public SchemaCapabilityProbe(DataSource dataSource) {
        this.dataSource = dataSource;
    }

    /**
     * Reads the column list of {@code users} from the connection metadata.
     *
     * @throws IllegalStateException if the metadata cannot be read
     */
    public SchemaCapabilities probe() {
        Set<String> columns = usersColumns();
        SchemaCapabilities capabilities =
                new SchemaCapabilities(
                        columns.contains("workspace_id"),
                        columns.contains("is_super_admin"),
                        columns.contains("email_verified"),
                        columns.contains("client_id"));
        if (capabilities.isComplete()) {
            log.info("Users table carries all tenancy columns");
        } else {
            log.warn("Users table is missing tenancy columns, running reduced: {}", capabilities);
        }
        return capabilities;
    }

    private Set<String> usersColumns() {
        try (Connection connection = dataSource.getConnection()) {
            DatabaseMetaData metaData = connection.getMetaData();
            Set<String> columns = new HashSet<>();
            try (ResultSet rs =
                    metaData.getColumns(
                            connection.getCatalog(), connection.getSchema(), USERS_TABLE, null)) {
                while (rs.next()) {
                    columns.add(rs.getString("COLUMN_NAME").toLowerCase(Locale.ROOT));
                }
            }
            return columns;
        } catch (SQLException e) {
            throw new IllegalStateException("Unable to inspect the users table", e);
        }
    }
}
