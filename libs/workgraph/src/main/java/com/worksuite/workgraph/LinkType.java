package com.worksuite.workgraph;

import java.util.Optional;

/**
 * Type of a directed link between two work items.
 * <p>
 * Only {@link #BLOCKS} and {@link #BLOCKED_BY} constrain the graph: they are two spellings of the
 * same dependency, read in opposite directions. The other types are informational.
 */
public enum LinkType {

    BLOCKS("blocks"),
    BLOCKED_BY("blocked_by"),
    RELATES_TO("relates_to"),
    DUPLICATES("duplicates"),
    CLONES("clones");

    private final String value;

    LinkType(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    public boolean isBlocking() {
        return this == BLOCKS || this == BLOCKED_BY;
    }

    /** The type that expresses the same dependency from the other end, for blocking types. */
    public Optional<LinkType> inverse() {
        return switch (this) {
            case BLOCKS -> Optional.of(BLOCKED_BY);
            case BLOCKED_BY -> Optional.of(BLOCKS);
            default -> Optional.empty();
        };
    }

    public static Optional<LinkType> fromValue(String value) {
        for (LinkType type : values()) {
            if (type.value.equals(value)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }
}
