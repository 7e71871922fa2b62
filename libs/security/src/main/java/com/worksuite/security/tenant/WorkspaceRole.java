package com.worksuite.security.tenant;

import com.worksuite.security.rbac.Action;
import com.worksuite.security.rbac.LegacyRole;

import java.util.Locale;
import java.util.Optional;

/**
 * Privilege tier inside one workspace, from highest to lowest.
 */
public enum WorkspaceRole {

    OWNER("owner"),
    ADMIN("admin"),
    MEMBER("member"),
    VIEWER("viewer");

    private final String value;

    WorkspaceRole(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    /**
     * Whether this tier may perform the action inside its workspace without a global grant.
     * <p>
     * Owners and admins may do anything, members anything except delete, viewers only view.
     */
    public boolean permits(Action action) {
        return switch (this) {
            case OWNER, ADMIN -> true;
            case MEMBER -> action != Action.DELETE;
            case VIEWER -> action == Action.VIEW;
        };
    }

    /**
     * Reads a stored membership role. Legacy user-level labels ("po", "manager", "accountant",
     * "client") map onto their workspace tier.
     */
    public static Optional<WorkspaceRole> fromLabel(String label) {
        if (label == null || label.isBlank()) {
            return Optional.empty();
        }
        String normalized = label.strip().toLowerCase(Locale.ROOT);
        for (WorkspaceRole role : values()) {
            if (role.value.equals(normalized)) {
                return Optional.of(role);
            }
        }
        return LegacyRole.fromLabel(normalized).map(LegacyRole::workspaceRole);
    }

    /**
     * Effective tier for a member: users whose legacy label is "admin" or "po" are workspace
     * admins regardless of the membership row; otherwise the membership role wins, falling back
     * to the legacy label mapping, then {@link #MEMBER}.
     */
    public static WorkspaceRole effective(String legacyLabel, WorkspaceRole membershipRole) {
        Optional<LegacyRole> legacy = LegacyRole.fromLabel(legacyLabel);
        boolean elevated = legacy.filter(r -> r == LegacyRole.ADMIN || r == LegacyRole.PO).isPresent();
        if (membershipRole != null && !elevated) {
            return membershipRole;
        }
        return legacy.map(LegacyRole::workspaceRole).orElse(MEMBER);
    }
}
