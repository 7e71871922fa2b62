package com.worksuite.security;

/**
 * Whether a workspace-scoped request only reads data or changes it.
 * <p>
 * Mutations are additionally subject to the subscription gate and require the workspace's
 * project to still exist. Listing endpoints may pass {@link #READ} to stay usable after a trial has
 * ended.
 */
public enum AccessMode {
    READ,
    MUTATION
}
