package com.worksuite.database.jdbc;

import com.worksuite.workgraph.LinkType;
import com.worksuite.workgraph.TaskLink;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.sql.ResultSet;
import java.sql.SQLException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

@DisplayName("JdbcTaskLinkStore row mapping")
class JdbcTaskLinkStoreTest {

    private ResultSet row;

    @BeforeEach
    void setUp() throws SQLException {
        row = mock(ResultSet.class);
        when(row.getLong("id")).thenReturn(7L);
        when(row.getLong("source_task_id")).thenReturn(11L);
        when(row.getLong("target_task_id")).thenReturn(12L);
    }

    @Test
    @DisplayName("a known link type maps to a task link")
    void knownType() throws SQLException {
        when(row.getString("link_type")).thenReturn("blocked_by");

        assertThat(JdbcTaskLinkStore.toLink(row))
                .contains(new TaskLink(7L, 11L, 12L, LinkType.BLOCKED_BY));
    }

    @Test
    @DisplayName("an unknown link type is skipped instead of failing the read")
    void unknownTypeSkipped() throws SQLException {
        when(row.getString("link_type")).thenReturn("follows");

        assertThat(JdbcTaskLinkStore.toLink(row)).isEmpty();
    }
}
