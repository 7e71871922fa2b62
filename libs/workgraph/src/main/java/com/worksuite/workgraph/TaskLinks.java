package com.worksuite.workgraph;

import java.util.List;

/**
 * Links of one work item, split by direction.
 *
 * @param outgoing links where the item is the source
 * @param incoming links where the item is the target
 */
public record TaskLinks(List<TaskLink> outgoing, List<TaskLink> incoming) {

    public TaskLinks {
        outgoing = List.copyOf(outgoing);
        incoming = List.copyOf(incoming);
    }
}
