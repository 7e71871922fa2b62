package com.worksuite.workgraph;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.OptionalLong;

/**
 * Creates, lists and removes work-item links.
 * <p>
 * Creation validates against the persisted graph and then inserts; there is no lock between the
 * two, so concurrent inserts on the same workspace may race. Deletion has no graph precondition.
 * Callers check workspace access before calling in.
 */
public class TaskLinkService {

    private static final Logger log = LoggerFactory.getLogger(TaskLinkService.class);

    private final TaskLinkStore store;
    private final DependencyGraphValidator validator;

    public TaskLinkService(TaskLinkStore store, DependencyGraphValidator validator) {
        this.store = store;
        this.validator = validator;
    }

    public LinkResult create(long sourceTaskId, long targetTaskId, LinkType type) {
        LinkValidationResult validation = validator.canInsert(sourceTaskId, targetTaskId, type);
        if (validation.rejected()) {
            log.info("Link {} {} {} rejected: {}",
                    sourceTaskId, type.value(), targetTaskId, validation.reason().value());
            return LinkResult.rejected(validation);
        }
        TaskLink stored = store.insert(TaskLink.of(sourceTaskId, targetTaskId, type));
        log.info("Created link {}: {} {} {}", stored.id(), sourceTaskId, type.value(), targetTaskId);
        return LinkResult.created(stored);
    }

    public TaskLinks linksOf(long taskId) {
        List<TaskLink> outgoing = new ArrayList<>();
        List<TaskLink> incoming = new ArrayList<>();
        for (TaskLink link : store.findByTask(taskId)) {
            if (link.sourceTaskId() == taskId) {
                outgoing.add(link);
            } else {
                incoming.add(link);
            }
        }
        return new TaskLinks(outgoing, incoming);
    }

    public Optional<TaskLink> find(long linkId) {
        return store.findById(linkId);
    }

    /** Workspace a link belongs to, taken from its source item. */
    public OptionalLong workspaceOf(TaskLink link) {
        return store.findWorkspaceId(link.sourceTaskId());
    }

    /** Workspace of a work item. */
    public OptionalLong workspaceOfTask(long taskId) {
        return store.findWorkspaceId(taskId);
    }

    /**
     * @return whether the link existed
     */
    public boolean delete(long linkId) {
        boolean removed = store.delete(linkId);
        if (removed) {
            log.info("Deleted link {}", linkId);
        }
        return removed;
    }
}
