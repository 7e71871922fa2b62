package com.worksuite.security.tenant;

import java.util.Locale;

/**
 * Administrative status of a workspace. Only {@link #ACTIVE} workspaces are usable.
 */
public enum WorkspaceStatus {

    ACTIVE("active"),
    SUSPENDED("suspended"),
    CANCELLED("cancelled");

    private final String value;

    WorkspaceStatus(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    /** Unknown values read as {@link #SUSPENDED}. */
    public static WorkspaceStatus fromValue(String value) {
        if (value != null) {
            String normalized = value.strip().toLowerCase(Locale.ROOT);
            for (WorkspaceStatus status : values()) {
                if (status.value.equals(normalized)) {
                    return status;
                }
            }
        }
        return SUSPENDED;
    }
}
