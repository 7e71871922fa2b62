package com.worksuite.security;

import java.util.Optional;

/**
 * Concrete failure reasons, each bound to its {@link FailureKind} and a stable wire value.
 * <p>
 * The wire value (e.g. {@code "trial_expired"}) is what clients see in error payloads, so it
 * must never change once released.
 */
public enum FailureCode {

    MISSING_CREDENTIAL(FailureKind.UNAUTHENTICATED, "missing_credential", "Access token required"),
    INVALID_CREDENTIAL(FailureKind.UNAUTHENTICATED, "invalid_credential", "Invalid token"),
    CREDENTIAL_EXPIRED(FailureKind.UNAUTHENTICATED, "credential_expired", "Token expired"),
    IDENTITY_NOT_FOUND(FailureKind.UNAUTHENTICATED, "identity_not_found", "User not found"),
    IDENTITY_DEACTIVATED(
            FailureKind.UNAUTHENTICATED, "identity_deactivated", "User account is deactivated"),

    ROLE_REQUIRED(FailureKind.FORBIDDEN, "role_required", "Insufficient permissions"),
    PERMISSION_REQUIRED(FailureKind.FORBIDDEN, "permission_required", "Insufficient permissions"),
    WORKSPACE_ACCESS_DENIED(
            FailureKind.FORBIDDEN,
            "workspace_access_denied",
            "Access denied. You do not have access to this workspace."),
    WORKSPACE_INACTIVE(FailureKind.FORBIDDEN, "workspace_inactive", "Workspace is not active"),
    NO_WORKSPACE(
            FailureKind.FORBIDDEN,
            "no_workspace",
            "No workspace assigned. Please contact your administrator."),
    TRIAL_EXPIRED(
            FailureKind.FORBIDDEN,
            "trial_expired",
            "Your free trial has ended. Please upgrade or contact sales to continue."),
    CLIENT_ACCESS_DENIED(
            FailureKind.FORBIDDEN, "client_access_denied", "Access denied to this client's data"),
    PROTECTED_ROLE(
            FailureKind.FORBIDDEN,
            "protected_role",
            "Cannot modify super admin role. This role is protected."),

    WORKSPACE_NOT_FOUND(FailureKind.NOT_FOUND, "workspace_not_found", "Workspace not found"),
    TASK_NOT_FOUND(FailureKind.NOT_FOUND, "task_not_found", "One or both tasks not found"),

    PROJECT_UNAVAILABLE(
            FailureKind.RESOURCE_GONE,
            "project_unavailable",
            "This project is no longer available. Contact the administrator."),

    INVALID_LINK(FailureKind.GRAPH_CONFLICT, "invalid_link", "Cannot link a task to itself"),
    DUPLICATE_LINK(FailureKind.GRAPH_CONFLICT, "duplicate_link", "This link already exists"),
    CYCLIC_DEPENDENCY(
            FailureKind.GRAPH_CONFLICT, "cyclic_dependency", "Cannot create circular dependency"),

    UNRESOLVED_ROLE(
            FailureKind.DATA_INTEGRITY_WARNING,
            "unresolved_role",
            "Legacy role label does not match a known role"),
    UNKNOWN_PERMISSION(
            FailureKind.DATA_INTEGRITY_WARNING,
            "unknown_permission",
            "Stored permission does not match a known module/action"),
    UNKNOWN_LINK_TYPE(
            FailureKind.DATA_INTEGRITY_WARNING,
            "unknown_link_type",
            "Stored work-item link has an unknown type");

    private final FailureKind kind;
    private final String value;
    private final String defaultMessage;

    FailureCode(FailureKind kind, String value, String defaultMessage) {
        this.kind = kind;
        this.value = value;
        this.defaultMessage = defaultMessage;
    }

    public FailureKind kind() {
        return kind;
    }

    /** Stable snake_case identifier used in error payloads. */
    public String value() {
        return value;
    }

    public String defaultMessage() {
        return defaultMessage;
    }

    /** Looks up a code by its wire value. */
    public static Optional<FailureCode> fromValue(String value) {
        for (FailureCode code : values()) {
            if (code.value.equals(value)) {
                return Optional.of(code);
            }
        }
        return Optional.empty();
    }
}
