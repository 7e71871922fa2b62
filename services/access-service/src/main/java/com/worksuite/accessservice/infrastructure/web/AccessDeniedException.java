package com.worksuite.accessservice.infrastructure.web;

import com.worksuite.security.AccessDecision;

/**
 * Carries a denied {@link AccessDecision} from a controller to {@link GlobalExceptionHandler}.
 */
public class AccessDeniedException extends RuntimeException {

    private final AccessDecision decision;

    public AccessDeniedException(AccessDecision decision) {
        super(decision.message());
        if (decision.allowed()) {
            throw new IllegalArgumentException("decision must be a denial");
        }
        this.decision = decision;
    }

    /** Throws when the decision is a denial; returns normally otherwise. */
    public static void check(AccessDecision decision) {
        if (decision.denied()) {
            throw new AccessDeniedException(decision);
        }
    }

    public AccessDecision decision() {
        return decision;
    }
}
