package com.worksuite.security;

import java.time.Instant;
import java.util.Objects;

/**
 * Outcome of a single access check.
 * <p>
 * Either allowed, or denied with a {@link FailureCode}. The code's {@link FailureKind} tells the
 * caller whether the denial is a permission problem ({@code FORBIDDEN}), a missing resource ({@code
 * NOT_FOUND}) or a dead workspace ({@code RESOURCE_GONE}), so existence can be reported separately
 * from permission where the caller wants that.
 *
 * @param allowed whether access is granted
 * @param reason denial reason, {@code null} when allowed
 * @param message human-readable detail, {@code null} when allowed
 * @param trialEndsAt trial end date, set only for {@link FailureCode#TRIAL_EXPIRED}
 */
public record AccessDecision(
        boolean allowed, FailureCode reason, String message, Instant trialEndsAt) {

    private static final AccessDecision ALLOWED = new AccessDecision(true, null, null, null);

    public AccessDecision {
        if (allowed && reason != null) {
            throw new IllegalArgumentException("an allowed decision carries no reason");
        }
        if (!allowed) {
            Objects.requireNonNull(reason, "reason");
            if (message == null) {
                message = reason.defaultMessage();
            }
        }
    }

    public static AccessDecision allow() {
        return ALLOWED;
    }

    public static AccessDecision deny(FailureCode reason) {
        return new AccessDecision(false, reason, reason.defaultMessage(), null);
    }

    public static AccessDecision deny(FailureCode reason, String message) {
        return new AccessDecision(false, reason, message, null);
    }

    public static AccessDecision trialExpired(Instant trialEndsAt) {
        return new AccessDecision(
                false,
                FailureCode.TRIAL_EXPIRED,
                FailureCode.TRIAL_EXPIRED.defaultMessage(),
                trialEndsAt);
    }

    public boolean denied() {
        return !allowed;
    }

    /** Kind of the denial, or {@code null} when allowed. */
    public FailureKind kind() {
        return allowed ? null : reason.kind();
    }

    public boolean isForbidden() {
        return kind() == FailureKind.FORBIDDEN;
    }

    public boolean isNotFound() {
        return kind() == FailureKind.NOT_FOUND;
    }

    public boolean isGone() {
        return kind() == FailureKind.RESOURCE_GONE;
    }
}
