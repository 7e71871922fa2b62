package com.worksuite.database.jdbc;

import com.worksuite.security.identity.SchemaCapabilities;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.jdbc.core.JdbcTemplate;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;

@DisplayName("JdbcIdentityStore query shape")
class JdbcIdentityStoreTest {

    private final JdbcTemplate jdbcTemplate = mock(JdbcTemplate.class);

    @Test
    @DisplayName("a legacy schema never selects the optional columns")
    void legacySelect() {
        String sql = new JdbcIdentityStore(jdbcTemplate, SchemaCapabilities.legacy()).selectSql();

        assertThat(sql)
                .startsWith("SELECT id, username, email, full_name, is_active, role FROM users")
                .doesNotContain("workspace_id")
                .doesNotContain("is_super_admin")
                .doesNotContain("email_verified")
                .doesNotContain("client_id");
    }

    @Test
    @DisplayName("a full schema selects every optional column")
    void fullSelect() {
        String sql = new JdbcIdentityStore(jdbcTemplate, SchemaCapabilities.full()).selectSql();

        assertThat(sql).contains("workspace_id, is_super_admin, email_verified, client_id FROM users");
    }

    @Test
    @DisplayName("only the detected columns are selected")
    void partialSelect() {
        SchemaCapabilities capabilities = new SchemaCapabilities(true, false, false, true);

        String sql = new JdbcIdentityStore(jdbcTemplate, capabilities).selectSql();

        assertThat(sql).contains("role, workspace_id, client_id FROM users").doesNotContain("is_super_admin");
    }
}
