package com.worksuite.security.tenant;

import java.util.Locale;

/**
 * Lifecycle of a workspace membership row.
 */
public enum MembershipStatus {

    PENDING("pending"),
    ACTIVE("active"),
    INACTIVE("inactive");

    private final String value;

    MembershipStatus(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    public static MembershipStatus fromValue(String value) {
        if (value != null) {
            String normalized = value.strip().toLowerCase(Locale.ROOT);
            for (MembershipStatus status : values()) {
                if (status.value.equals(normalized)) {
                    return status;
                }
            }
        }
        return INACTIVE;
    }
}
