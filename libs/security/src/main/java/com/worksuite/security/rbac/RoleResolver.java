package com.worksuite.security.rbac;

import com.worksuite.security.FailureCode;
import com.worksuite.security.identity.Identity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;

/**
 * Maps a user to its roles.
 * <p>
 * Explicit assignments win. Users without any fall back to the single role named by their legacy
 * label; an unknown label is a data-integrity warning, logged, and yields no roles.
 */
public class RoleResolver {

    private static final Logger log = LoggerFactory.getLogger(RoleResolver.class);

    private final RoleStore store;

    public RoleResolver(RoleStore store) {
        this.store = store;
    }

    public RoleResolution resolve(Identity identity) {
        List<Role> assigned = store.findAssignedRoles(identity.id());
        if (!assigned.isEmpty()) {
            return new RoleResolution(assigned, RoleResolution.Source.EXPLICIT, identity.legacyRole());
        }

        String label = identity.legacyRole();
        if (label == null || label.isBlank()) {
            return new RoleResolution(List.of(), RoleResolution.Source.NONE, label);
        }

        Optional<Role> byName = store.findByName(label.strip());
        if (byName.isPresent()) {
            return new RoleResolution(
                    List.of(byName.get()), RoleResolution.Source.LEGACY_LABEL, label);
        }

        log.warn("{}: user {} has legacy role '{}' with no matching role row",
                FailureCode.UNRESOLVED_ROLE.value(), identity.id(), label);
        return new RoleResolution(List.of(), RoleResolution.Source.UNRESOLVED, label);
    }
}
