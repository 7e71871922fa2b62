package com.worksuite.security.tenant;

import com.worksuite.security.identity.Identity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Determines the caller's workspace.
 * <p>
 * Order: super-admin bypass, the workspace claim of the credential (only while the caller
 * still owns or actively belongs to it), the tenant id on the user row, then the most recently
 * joined active membership. Returning {@link TenantResolution#none()} is not an error;
 * callers that need a tenant report {@code no_workspace} themselves.
 */
public class TenantResolver {

    private static final Logger log = LoggerFactory.getLogger(TenantResolver.class);

    private final WorkspaceStore store;

    public TenantResolver(WorkspaceStore store) {
        this.store = store;
    }

    /**
     * @param identity authenticated user
     * @param credentialHint workspace id embedded in the credential, may be null
     */
    public TenantResolution resolve(Identity identity, Long credentialHint) {
        if (identity.superAdmin()) {
            return TenantResolution.superAdmin();
        }

        if (credentialHint != null) {
            Optional<TenantResolution> hinted = resolveHint(identity, credentialHint);
            if (hinted.isPresent()) {
                return hinted.get();
            }
            log.debug("Ignoring workspace claim {} for user {}", credentialHint, identity.id());
        }

        if (identity.tenantId() != null) {
            Optional<Workspace> explicit = store.findById(identity.tenantId()).filter(Workspace::isUsable);
            if (explicit.isEmpty()) {
                log.debug("User {} is bound to unusable workspace {}", identity.id(), identity.tenantId());
                return TenantResolution.none();
            }
            Workspace workspace = explicit.get();
            return new TenantResolution(
                    workspace, roleIn(workspace, identity), TenantResolution.Source.IDENTITY);
        }

        Optional<WorkspaceMembership> latest = store.findLatestActiveMembership(identity.id());
        if (latest.isPresent()) {
            WorkspaceMembership membership = latest.get();
            Optional<Workspace> workspace =
                    store.findById(membership.workspaceId()).filter(Workspace::isUsable);
            if (workspace.isPresent()) {
                WorkspaceRole role = workspace.get().isOwnedBy(identity.id())
                        ? WorkspaceRole.OWNER
                        : WorkspaceRole.effective(identity.legacyRole(), membership.role());
                return new TenantResolution(workspace.get(), role, TenantResolution.Source.MEMBERSHIP);
            }
        }
        return TenantResolution.none();
    }

    private Optional<TenantResolution> resolveHint(Identity identity, long workspaceId) {
        Optional<Workspace> workspace = store.findById(workspaceId).filter(Workspace::isUsable);
        if (workspace.isEmpty()) {
            return Optional.empty();
        }
        Workspace ws = workspace.get();
        if (ws.isOwnedBy(identity.id())) {
            return Optional.of(new TenantResolution(
                    ws, WorkspaceRole.OWNER, TenantResolution.Source.CREDENTIAL_HINT));
        }
        return store.findActiveMembership(workspaceId, identity.id())
                .map(m -> new TenantResolution(
                        ws,
                        WorkspaceRole.effective(identity.legacyRole(), m.role()),
                        TenantResolution.Source.CREDENTIAL_HINT));
    }

    private WorkspaceRole roleIn(Workspace workspace, Identity identity) {
        if (workspace.isOwnedBy(identity.id())) {
            return WorkspaceRole.OWNER;
        }
        WorkspaceRole membershipRole = store.findActiveMembership(workspace.id(), identity.id())
                .map(WorkspaceMembership::role)
                .orElse(null);
        return WorkspaceRole.effective(identity.legacyRole(), membershipRole);
    }
}
