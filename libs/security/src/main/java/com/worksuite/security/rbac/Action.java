package com.worksuite.security.rbac;

import java.util.Optional;

/**
 * Operations a permission allows on a {@link Module}.
 */
public enum Action {

    VIEW("view"),
    CREATE("create"),
    EDIT("edit"),
    DELETE("delete"),
    UPLOAD("upload"),
    DOWNLOAD("download"),
    RECORD_PAYMENT("record_payment");

    private final String value;

    Action(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    public static Optional<Action> fromValue(String value) {
        if (value == null) {
            return Optional.empty();
        }
        for (Action action : values()) {
            if (action.value.equals(value)) {
                return Optional.of(action);
            }
        }
        return Optional.empty();
    }

    /** Whether the action changes state (anything other than reading). */
    public boolean isMutation() {
        return this != VIEW && this != DOWNLOAD;
    }
}
