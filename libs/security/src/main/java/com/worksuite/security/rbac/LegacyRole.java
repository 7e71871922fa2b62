package com.worksuite.security.rbac;

import com.worksuite.security.tenant.WorkspaceRole;

import java.util.Locale;
import java.util.Optional;

/**
 * Single role label stored on the user row by pre-RBAC deployments.
 * <p>
 * The label is still consulted when a user has no explicit role assignments, and it decides
 * client-data scope and workspace-level mapping.
 */
public enum LegacyRole {

    ADMIN("admin", WorkspaceRole.ADMIN, true),
    PO("po", WorkspaceRole.ADMIN, true),
    MANAGER("manager", WorkspaceRole.ADMIN, true),
    ACCOUNTANT("accountant", WorkspaceRole.MEMBER, true),
    CLIENT("client", WorkspaceRole.MEMBER, false),
    VIEWER("viewer", WorkspaceRole.VIEWER, false);

    private final String label;
    private final WorkspaceRole workspaceRole;
    private final boolean allClientData;

    LegacyRole(String label, WorkspaceRole workspaceRole, boolean allClientData) {
        this.label = label;
        this.workspaceRole = workspaceRole;
        this.allClientData = allClientData;
    }

    public String label() {
        return label;
    }

    /** Workspace-level role this label maps to. */
    public WorkspaceRole workspaceRole() {
        return workspaceRole;
    }

    /** Whether holders of this label see every client's data. */
    public boolean seesAllClientData() {
        return allClientData;
    }

    /**
     * Matches a stored label, ignoring case and surrounding whitespace.
     */
    public static Optional<LegacyRole> fromLabel(String label) {
        if (label == null || label.isBlank()) {
            return Optional.empty();
        }
        String normalized = label.strip().toLowerCase(Locale.ROOT);
        for (LegacyRole role : values()) {
            if (role.label.equals(normalized)) {
                return Optional.of(role);
            }
        }
        return Optional.empty();
    }
}
