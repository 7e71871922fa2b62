package com.worksuite.workgraph;

import com.worksuite.security.FailureCode;

/**
 * Verdict of {@link DependencyGraphValidator#canInsert}.
 *
 * @param accepted whether the link may be inserted
 * @param reason rejection reason, {@code null} when accepted
 * @param message rejection detail for the user, {@code null} when accepted
 */
public record LinkValidationResult(boolean accepted, FailureCode reason, String message) {

    private static final LinkValidationResult OK = new LinkValidationResult(true, null, null);

    public static LinkValidationResult ok() {
        return OK;
    }

    public static LinkValidationResult reject(FailureCode reason) {
        return new LinkValidationResult(false, reason, reason.defaultMessage());
    }

    public static LinkValidationResult reject(FailureCode reason, String message) {
        return new LinkValidationResult(false, reason, message);
    }

    public boolean rejected() {
        return !accepted;
    }
}
