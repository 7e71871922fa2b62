package com.worksuite.workgraph;

import java.util.List;
import java.util.Optional;
import java.util.OptionalLong;

/**
 * Persistence for work-item links. Every read goes to the backing store.
 */
public interface TaskLinkStore {

    /**
     * Workspace of a work item.
     *
     * @return the workspace id, or empty if the item does not exist
     */
    OptionalLong findWorkspaceId(long taskId);

    /** Whether a link with exactly this source, target and type exists. */
    boolean exists(long sourceTaskId, long targetTaskId, LinkType type);

    /** {@code blocks} and {@code blocked_by} links that have the item as source or target. */
    List<TaskLink> findBlockingLinks(long taskId);

    /** All links that have the item as source or target. */
    List<TaskLink> findByTask(long taskId);

    Optional<TaskLink> findById(long linkId);

    /** Inserts the link and returns it with its generated id. */
    TaskLink insert(TaskLink link);

    /**
     * Deletes a link.
     *
     * @return whether a row was removed
     */
    boolean delete(long linkId);
}
