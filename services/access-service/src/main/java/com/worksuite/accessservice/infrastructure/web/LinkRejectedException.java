package com.worksuite.accessservice.infrastructure.web;

import com.worksuite.workgraph.LinkValidationResult;

/** A work-item link the dependency graph refused. */
public class LinkRejectedException extends RuntimeException {

    private final LinkValidationResult validation;

    public LinkRejectedException(LinkValidationResult validation) {
        super(validation.message());
        this.validation = validation;
    }

    public LinkValidationResult validation() {
        return validation;
    }
}
