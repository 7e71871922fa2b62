package com.worksuite.accessservice.api;

import com.worksuite.workgraph.TaskLink;

import java.util.List;

public record TaskLinkResponse(long id, long sourceTaskId, long targetTaskId, String linkType) {

    public static TaskLinkResponse from(TaskLink link) {
        return new TaskLinkResponse(
                link.id(), link.sourceTaskId(), link.targetTaskId(), link.type().value());
    }

    static List<TaskLinkResponse> fromAll(List<TaskLink> links) {
        return links.stream().map(TaskLinkResponse::from).toList();
    }
}
