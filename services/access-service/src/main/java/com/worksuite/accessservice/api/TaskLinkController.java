package com.worksuite.accessservice.api;

import com.worksuite.accessservice.infrastructure.web.AccessDeniedException;
import com.worksuite.accessservice.infrastructure.web.AuthorizationFilter;
import com.worksuite.accessservice.infrastructure.web.LinkRejectedException;
import com.worksuite.security.AccessDecisionPoint;
import com.worksuite.security.AccessMode;
import com.worksuite.security.AuthorizationContext;
import com.worksuite.security.FailureCode;
import com.worksuite.security.rbac.Action;
import com.worksuite.security.rbac.Module;
import com.worksuite.security.rbac.Permission;
import com.worksuite.workgraph.LinkResult;
import com.worksuite.workgraph.LinkType;
import com.worksuite.workgraph.LinkValidationResult;
import com.worksuite.workgraph.TaskLink;
import com.worksuite.workgraph.TaskLinkService;
import com.worksuite.workgraph.TaskLinks;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestAttribute;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;
import java.util.OptionalLong;

/**
 * Work-item links inside one workspace.
 * <p>
 * Changing links needs {@code projects.edit} (or an owner/admin tier) and a live subscription;
 * reading them needs {@code projects.view}. Items and links of other workspaces are reported as
 * not found.
 */
@RestController
@RequestMapping("/api/v1/workspaces/{workspaceId}")
public class TaskLinkController {

    static final Permission VIEW_TASKS = Permission.of(Module.PROJECTS, Action.VIEW);
    static final Permission EDIT_TASKS = Permission.of(Module.PROJECTS, Action.EDIT);

    private final AccessDecisionPoint decisionPoint;
    private final TaskLinkService linkService;

    public TaskLinkController(AccessDecisionPoint decisionPoint, TaskLinkService linkService) {
        this.decisionPoint = decisionPoint;
        this.linkService = linkService;
    }

    @PostMapping("/task-links")
    @ResponseStatus(HttpStatus.CREATED)
    public TaskLinkResponse create(
            @RequestAttribute(AuthorizationFilter.CONTEXT_ATTRIBUTE) AuthorizationContext ctx,
            @PathVariable long workspaceId,
            @Valid @RequestBody CreateTaskLinkRequest request) {
        AccessDeniedException.check(
                decisionPoint.requireWorkspacePermission(
                        ctx, workspaceId, EDIT_TASKS, AccessMode.MUTATION));
        LinkType type =
                LinkType.fromValue(request.linkType())
                        .orElseThrow(
                                () ->
                                        new IllegalArgumentException(
                                                "Unknown link type: " + request.linkType()));
        requireTaskIn(request.sourceTaskId(), workspaceId);
        requireTaskIn(request.targetTaskId(), workspaceId);

        LinkResult result = linkService.create(request.sourceTaskId(), request.targetTaskId(), type);
        if (!result.isCreated()) {
            throw new LinkRejectedException(result.validation());
        }
        return TaskLinkResponse.from(result.link());
    }

    @GetMapping("/tasks/{taskId}/links")
    public Map<String, List<TaskLinkResponse>> linksOf(
            @RequestAttribute(AuthorizationFilter.CONTEXT_ATTRIBUTE) AuthorizationContext ctx,
            @PathVariable long workspaceId,
            @PathVariable long taskId) {
        AccessDeniedException.check(
                decisionPoint.requireWorkspacePermission(
                        ctx, workspaceId, VIEW_TASKS, AccessMode.READ));
        requireTaskIn(taskId, workspaceId);

        TaskLinks links = linkService.linksOf(taskId);
        return Map.of(
                "outgoing", TaskLinkResponse.fromAll(links.outgoing()),
                "incoming", TaskLinkResponse.fromAll(links.incoming()));
    }

    @DeleteMapping("/task-links/{linkId}")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public void delete(
            @RequestAttribute(AuthorizationFilter.CONTEXT_ATTRIBUTE) AuthorizationContext ctx,
            @PathVariable long workspaceId,
            @PathVariable long linkId) {
        AccessDeniedException.check(
                decisionPoint.requireWorkspacePermission(
                        ctx, workspaceId, EDIT_TASKS, AccessMode.MUTATION));
        TaskLink link =
                linkService
                        .find(linkId)
                        .filter(l -> belongsTo(linkService.workspaceOf(l), workspaceId))
                        .orElseThrow(
                                () ->
                                        new LinkRejectedException(
                                                LinkValidationResult.reject(
                                                        FailureCode.TASK_NOT_FOUND, "Link not found")));
        linkService.delete(link.id());
    }

    private void requireTaskIn(long taskId, long workspaceId) {
        if (!belongsTo(linkService.workspaceOfTask(taskId), workspaceId)) {
            throw new LinkRejectedException(LinkValidationResult.reject(FailureCode.TASK_NOT_FOUND));
        }
    }

    private static boolean belongsTo(OptionalLong owner, long workspaceId) {
        return owner.isPresent() && owner.getAsLong() == workspaceId;
    }
}
