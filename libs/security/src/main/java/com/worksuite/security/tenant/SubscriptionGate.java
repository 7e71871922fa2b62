package com.worksuite.security.tenant;

import com.worksuite.security.AccessDecision;

import java.time.Clock;
import java.time.Instant;

/**
 * Decides whether a workspace's trial or subscription still permits access.
 * <p>
 * Allowed when the workspace has a subscription reference, is on a paid plan, has no trial end
 * recorded, or the trial has not yet ended. Otherwise denied with {@code trial_expired} and the
 * trial end date. No workspace means nothing to gate.
 */
public class SubscriptionGate {

    private final Clock clock;

    public SubscriptionGate(Clock clock) {
        this.clock = clock;
    }

    public AccessDecision evaluate(Workspace workspace) {
        if (workspace == null) {
            return AccessDecision.allow();
        }
        if (workspace.hasSubscription() || workspace.planType().isPaid()) {
            return AccessDecision.allow();
        }
        Instant trialEnd = workspace.trialEndsAt();
        if (trialEnd == null) {
            return AccessDecision.allow();
        }
        if (clock.instant().isBefore(trialEnd)) {
            return AccessDecision.allow();
        }
        return AccessDecision.trialExpired(trialEnd);
    }

    /** Super-admin scope and "no tenant" always pass. */
    public AccessDecision evaluate(TenantResolution resolution) {
        return evaluate(resolution.workspace());
    }
}
