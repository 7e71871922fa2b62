package com.worksuite.accessservice.api;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

/**
 * Body of {@code POST /api/v1/workspaces/{id}/task-links}.
 *
 * @param sourceTaskId work item the link starts from
 * @param targetTaskId work item the link points to
 * @param linkType {@code blocks}, {@code blocked_by}, {@code relates_to}, {@code duplicates} or
 *     {@code clones}
 */
public record CreateTaskLinkRequest(
        @NotNull Long sourceTaskId, @NotNull Long targetTaskId, @NotBlank String linkType) {
}
