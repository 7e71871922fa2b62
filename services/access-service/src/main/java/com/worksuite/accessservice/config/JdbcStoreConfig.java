package com.worksuite.accessservice.config;

import com.worksuite.database.jdbc.JdbcIdentityStore;
import com.worksuite.database.jdbc.JdbcPermissionStore;
import com.worksuite.database.jdbc.JdbcRoleStore;
import com.worksuite.database.jdbc.JdbcTaskLinkStore;
import com.worksuite.database.jdbc.JdbcWorkspaceStore;
import com.worksuite.database.jdbc.SchemaCapabilityProbe;
import com.worksuite.security.identity.SchemaCapabilities;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.sql.init.dependency.DependsOnDatabaseInitialization;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.JdbcTemplate;

import javax.sql.DataSource;

/**
 * PostgreSQL-backed stores. The schema is probed once, after Flyway has run.
 */
@Configuration
@ConditionalOnProperty(
        prefix = "worksuite.access",
        name = "store",
        havingValue = "jdbc",
        matchIfMissing = true)
public class JdbcStoreConfig {

    @Bean
    @DependsOnDatabaseInitialization
    public SchemaCapabilities schemaCapabilities(DataSource dataSource) {
        return new SchemaCapabilityProbe(dataSource).probe();
    }

    @Bean
    public JdbcIdentityStore identityStore(JdbcTemplate jdbcTemplate, SchemaCapabilities capabilities) {
        return new JdbcIdentityStore(jdbcTemplate, capabilities);
    }

    @Bean
    public JdbcRoleStore roleStore(JdbcTemplate jdbcTemplate) {
        return new JdbcRoleStore(jdbcTemplate);
    }

    @Bean
    public JdbcPermissionStore permissionStore(JdbcTemplate jdbcTemplate) {
        return new JdbcPermissionStore(jdbcTemplate);
    }

    @Bean
    public JdbcWorkspaceStore workspaceStore(JdbcTemplate jdbcTemplate) {
        return new JdbcWorkspaceStore(jdbcTemplate);
    }

    @Bean
    public JdbcTaskLinkStore taskLinkStore(JdbcTemplate jdbcTemplate) {
        return new JdbcTaskLinkStore(jdbcTemplate);
    }
}
