package com.worksuite.database.jdbc;

import com.worksuite.security.FailureCode;
import com.worksuite.workgraph.LinkType;
import com.worksuite.workgraph.TaskLink;
import com.worksuite.workgraph.TaskLinkStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.support.GeneratedKeyHolder;
import org.springframework.jdbc.support.KeyHolder;

import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.List;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.stream.Collectors;

/**
 * Task link store over {@code work_items} and {@code task_links}.
 * <p>
 * Rows whose {@code link_type} is not a known {@link LinkType} are logged and left out of every
 * read.
 */
public class JdbcTaskLinkStore implements TaskLinkStore {

    private static final Logger log = LoggerFactory.getLogger(JdbcTaskLinkStore.class);

    private static final String LINK_COLUMNS = "id, source_task_id, target_task_id, link_type";

    private static final RowMapper<Optional<TaskLink>> LINK_MAPPER = (rs, rowNum) -> toLink(rs);

    private final JdbcTemplate jdbcTemplate;

    public JdbcTaskLinkStore(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Override
    public OptionalLong findWorkspaceId(long taskId) {
        List<Long> ids =
                jdbcTemplate.queryForList(
                        "SELECT workspace_id FROM work_items WHERE id = ?", Long.class, taskId);
        return ids.isEmpty() ? OptionalLong.empty() : OptionalLong.of(ids.get(0));
    }

    @Override
    public boolean exists(long sourceTaskId, long targetTaskId, LinkType type) {
        Boolean found =
                jdbcTemplate.queryForObject(
                        "SELECT EXISTS (SELECT 1 FROM task_links"
                                + " WHERE source_task_id = ? AND target_task_id = ? AND link_type = ?)",
                        Boolean.class,
                        sourceTaskId,
                        targetTaskId,
                        type.value());
        return Boolean.TRUE.equals(found);
    }

    @Override
    public List<TaskLink> findBlockingLinks(long taskId) {
        return queryLinks(
                "SELECT " + LINK_COLUMNS + " FROM task_links"
                        + " WHERE (source_task_id = ? OR target_task_id = ?)"
                        + " AND link_type IN (?, ?) ORDER BY id",
                taskId,
                taskId,
                LinkType.BLOCKS.value(),
                LinkType.BLOCKED_BY.value());
    }

    @Override
    public List<TaskLink> findByTask(long taskId) {
        return queryLinks(
                "SELECT " + LINK_COLUMNS + " FROM task_links"
                        + " WHERE source_task_id = ? OR target_task_id = ? ORDER BY id",
                taskId,
                taskId);
    }

    @Override
    public Optional<TaskLink> findById(long linkId) {
        return queryLinks("SELECT " + LINK_COLUMNS + " FROM task_links WHERE id = ?", linkId)
                .stream()
                .findFirst();
    }

    @Override
    public TaskLink insert(TaskLink link) {
        KeyHolder keyHolder = new GeneratedKeyHolder();
        jdbcTemplate.update(
                connection -> {
                    PreparedStatement ps =
                            connection.prepareStatement(
                                    "INSERT INTO task_links (source_task_id, target_task_id, link_type)"
                                            + " VALUES (?, ?, ?)",
                                    new String[] {"id"});
                    ps.setLong(1, link.sourceTaskId());
                    ps.setLong(2, link.targetTaskId());
                    ps.setString(3, link.type().value());
                    return ps;
                },
                keyHolder);
        Number key = keyHolder.getKey();
        if (key == null) {
            throw new IllegalStateException("Insert into task_links returned no id");
        }
        return link.withId(key.longValue());
    }

    @Override
    public boolean delete(long linkId) {
        return jdbcTemplate.update("DELETE FROM task_links WHERE id = ?", linkId) > 0;
    }

    private List<TaskLink> queryLinks(String sql, Object... args) {
        return jdbcTemplate.query(sql, LINK_MAPPER, args).stream()
                .flatMap(Optional::stream)
                .collect(Collectors.toList());
    }

    static Optional<TaskLink> toLink(ResultSet rs) throws SQLException {
        long id = rs.getLong("id");
        String type = rs.getString("link_type");
        Optional<LinkType> linkType = LinkType.fromValue(type);
        if (linkType.isEmpty()) {
            log.warn("{}: skipping task link {} with type '{}'",
                    FailureCode.UNKNOWN_LINK_TYPE.value(), id, type);
            return Optional.empty();
        }
        return Optional.of(new TaskLink(
                id, rs.getLong("source_task_id"), rs.getLong("target_task_id"), linkType.get()));
    }
}
