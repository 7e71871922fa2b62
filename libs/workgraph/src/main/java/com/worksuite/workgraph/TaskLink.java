package com.worksuite.workgraph;

import java.util.Objects;

/**
 * A stored link row: {@code source} {@code type} {@code target}, e.g. "12 blocks 15".
 *
 * @param id row id, {@code null} before insertion
 * @param sourceTaskId source work item
 * @param targetTaskId target work item
 * @param type link type
 */
public record TaskLink(Long id, long sourceTaskId, long targetTaskId, LinkType type) {

    public TaskLink {
        Objects.requireNonNull(type, "type");
    }

    public static TaskLink of(long sourceTaskId, long targetTaskId, LinkType type) {
        return new TaskLink(null, sourceTaskId, targetTaskId, type);
    }

    public TaskLink withId(long newId) {
        return new TaskLink(newId, sourceTaskId, targetTaskId, type);
    }

    /**
     * The item that must finish first. For "A blocks B" that is A; for "A blocked_by B" it is B.
     *
     * @throws IllegalStateException for non-blocking links
     */
    public long blocker() {
        requireBlocking();
        return type == LinkType.BLOCKS ? sourceTaskId : targetTaskId;
    }

    /** The item that waits on {@link #blocker()}. */
    public long blocked() {
        requireBlocking();
        return type == LinkType.BLOCKS ? targetTaskId : sourceTaskId;
    }

    public boolean touches(long taskId) {
        return sourceTaskId == taskId || targetTaskId == taskId;
    }

    private void requireBlocking() {
        if (!type.isBlocking()) {
            throw new IllegalStateException(type.value() + " links carry no dependency direction");
        }
    }
}
