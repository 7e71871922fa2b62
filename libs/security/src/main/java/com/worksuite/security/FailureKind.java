package com.worksuite.security;

/**
 * Top-level classification of every non-success outcome produced by the access control engine.
 * <p>
 * Callers branch on the kind, never on message text. The request layer maps each kind to a
 * response status; only storage failures (which are not represented here) may be retried.
 */
public enum FailureKind {

    /** Missing, invalid or expired credential, or an unknown or deactivated identity. */
    UNAUTHENTICATED,

    /** Authenticated, but lacking the required role, permission, relationship or subscription. */
    FORBIDDEN,

    /** The addressed resource does not exist (or is hidden from the caller). */
    NOT_FOUND,

    /** The workspace row exists but its underlying project is gone. */
    RESOURCE_GONE,

    /** A work-item link would break the integrity of the dependency graph. */
    GRAPH_CONFLICT,

    /** Non-fatal inconsistency in stored authorization data; logged, never surfaced. */
    DATA_INTEGRITY_WARNING
}
