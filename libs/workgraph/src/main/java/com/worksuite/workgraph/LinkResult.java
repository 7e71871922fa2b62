package com.worksuite.workgraph;

import com.worksuite.security.FailureCode;

/**
 * Outcome of {@link TaskLinkService#create}: the stored link, or the validation failure.
 *
 * @param link inserted link, {@code null} when rejected
 * @param validation validator verdict
 */
public record LinkResult(TaskLink link, LinkValidationResult validation) {

    public static LinkResult created(TaskLink link) {
        return new LinkResult(link, LinkValidationResult.ok());
    }

    public static LinkResult rejected(LinkValidationResult validation) {
        return new LinkResult(null, validation);
    }

    public boolean isCreated() {
        return link != null;
    }

    public FailureCode reason() {
        return validation.reason();
    }
}
