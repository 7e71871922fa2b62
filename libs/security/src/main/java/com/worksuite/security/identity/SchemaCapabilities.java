package com.worksuite.security.identity;

/**
 * Which optional columns the {@code users} table carries on this deployment.
 * <p>
 * Detected once at startup and passed to the identity store, so queries never rely on catching
 * "unknown column" errors per request.
 *
 * @param tenantColumn {@code users.workspace_id}
 * @param superAdminColumn {@code users.is_super_admin}
 * @param emailVerifiedColumn {@code users.email_verified}
 * @param clientColumn {@code users.client_id}
 */
public record SchemaCapabilities(
        boolean tenantColumn,
        boolean superAdminColumn,
        boolean emailVerifiedColumn,
        boolean clientColumn) {

    /** Fully migrated multi-tenant schema. */
    public static SchemaCapabilities full() {
        return new SchemaCapabilities(true, true, true, true);
    }

    /** Pre-tenancy schema with none of the optional columns. */
    public static SchemaCapabilities legacy() {
        return new SchemaCapabilities(false, false, false, false);
    }

    public boolean isComplete() {
        return tenantColumn && superAdminColumn && emailVerifiedColumn && clientColumn;
    }
}
