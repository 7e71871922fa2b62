package com.worksuite.security.rbac;

/**
 * Raw row from the {@code permissions} table, before validation against {@link Module} and
 * {@link Action}.
 *
 * @param id permission id
 * @param module stored module value
 * @param action stored action value
 * @param description free-text description, may be null
 */
public record PermissionRecord(long id, String module, String action, String description) {
}
