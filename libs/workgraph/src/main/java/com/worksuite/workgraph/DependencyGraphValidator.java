package com.worksuite.workgraph;

import com.worksuite.security.FailureCode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashSet;
import java.util.OptionalLong;
import java.util.Set;

/**
 * Checks that a new link keeps a workspace's blocking graph acyclic and free of redundant edges.
 * <p>
 * {@code blocks} and {@code blocked_by} rows are normalised to a single dependency edge
 * blocker &rarr; blocked. Inserting u &rarr; v closes a cycle iff u is reachable from v, which is
 * searched breadth-first over persisted edges up to {@code maxDepth} edges. The validator keeps
 * no graph in memory: every call reads the store afresh.
 */
public class DependencyGraphValidator {

    public static final int DEFAULT_MAX_DEPTH = 10;

    private static final Logger log = LoggerFactory.getLogger(DependencyGraphValidator.class);

    private final TaskLinkStore store;
    private final int maxDepth;

    public DependencyGraphValidator(TaskLinkStore store) {
        this(store, DEFAULT_MAX_DEPTH);
    }

    public DependencyGraphValidator(TaskLinkStore store, int maxDepth) {
        if (maxDepth < 1) {
            throw new IllegalArgumentException("maxDepth must be at least 1, was " + maxDepth);
        }
        this.store = store;
        this.maxDepth = maxDepth;
    }

    /**
     * Decides whether {@code source type target} may be inserted.
     * <p>
     * Checks, in order: self link, both items exist, same workspace, exact duplicate, a reverse
     * blocking link between the same pair, direct inverse dependency, transitive cycle.
     */
    public LinkValidationResult canInsert(long sourceTaskId, long targetTaskId, LinkType type) {
        if (sourceTaskId == targetTaskId) {
            return LinkValidationResult.reject(FailureCode.INVALID_LINK);
        }

        OptionalLong sourceWorkspace = store.findWorkspaceId(sourceTaskId);
        OptionalLong targetWorkspace = store.findWorkspaceId(targetTaskId);
        if (sourceWorkspace.isEmpty() || targetWorkspace.isEmpty()) {
            return LinkValidationResult.reject(FailureCode.TASK_NOT_FOUND);
        }
        if (sourceWorkspace.getAsLong() != targetWorkspace.getAsLong()) {
            return LinkValidationResult.reject(FailureCode.INVALID_LINK, "Tasks must be in the same workspace");
        }

        if (store.exists(sourceTaskId, targetTaskId, type)) {
            return LinkValidationResult.reject(FailureCode.DUPLICATE_LINK);
        }
        if (!type.isBlocking()) {
            return LinkValidationResult.ok();
        }
        LinkType inverse = type.inverse().orElseThrow();
        if (store.exists(targetTaskId, sourceTaskId, inverse)) {
            return LinkValidationResult.reject(FailureCode.CYCLIC_DEPENDENCY);
        }

        TaskLink candidate = TaskLink.of(sourceTaskId, targetTaskId, type);
        long blocker = candidate.blocker();
        long blocked = candidate.blocked();
        if (blocksDirectly(blocked, blocker)) {
            return LinkValidationResult.reject(FailureCode.CYCLIC_DEPENDENCY);
        }
        if (reachable(blocked, blocker)) {
            log.debug("Rejected {} {} {}: {} already depends on {}",
                    sourceTaskId, type.value(), targetTaskId, blocker, blocked);
            return LinkValidationResult.reject(FailureCode.CYCLIC_DEPENDENCY);
        }
        return LinkValidationResult.ok();
    }

    public int maxDepth() {
        return maxDepth;
    }

    private boolean blocksDirectly(long from, long to) {
        for (TaskLink link : store.findBlockingLinks(from)) {
            if (link.blocker() == from && link.blocked() == to) {
                return true;
            }
        }
        return false;
    }

    private boolean reachable(long start, long goal) {
        Set<Long> visited = new HashSet<>();
        visited.add(start);
        Deque<Long> frontier = new ArrayDeque<>();
        frontier.add(start);
        for (int depth = 1; depth <= maxDepth && !frontier.isEmpty(); depth++) {
            Deque<Long> next = new ArrayDeque<>();
            for (Long node : frontier) {
                for (TaskLink link : store.findBlockingLinks(node)) {
                    if (link.blocker() != node) {
                        continue;
                    }
                    long successor = link.blocked();
                    if (successor == goal) {
                        return true;
                    }
                    if (visited.add(successor)) {
                        next.add(successor);
                    }
                }
            }
            frontier = next;
        }
        return false;
    }
}
