package com.worksuite.security.rbac;

import java.util.Optional;

/**
 * Functional areas that permissions are granted on.
 * <p>
 * The wire value matches the {@code permissions.module} column.
 */
public enum Module {

    CLIENTS("clients"),
    CONVERSATIONS("conversations"),
    CREDENTIALS("credentials"),
    DASHBOARD("dashboard"),
    FILES("files"),
    INVOICES("invoices"),
    PM_CHAT("pm_chat"),
    PROJECTS("projects"),
    QUOTATIONS("quotations"),
    REPORTS("reports"),
    ROLES("roles"),
    SETTINGS("settings"),
    USERS("users");

    private final String value;

    Module(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    public static Optional<Module> fromValue(String value) {
        if (value == null) {
            return Optional.empty();
        }
        for (Module module : values()) {
            if (module.value.equals(value)) {
                return Optional.of(module);
            }
        }
        return Optional.empty();
    }
}
