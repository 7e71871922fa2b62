package com.worksuite.security.rbac;

import com.worksuite.security.AccessDecision;
import com.worksuite.security.FailureCode;

/**
 * Blocks edits and deletion of the protected all-access role.
 */
public final class ProtectedRoleGuard {

    private ProtectedRoleGuard() {
        // utility class
    }

    /**
     * Checks whether a role may be updated, have its permissions replaced, or be deleted.
     *
     * @return forbidden with {@code protected_role} for the protected role, allowed otherwise
     */
    public static AccessDecision checkModifiable(Role role) {
        if (role.isProtected()) {
            return AccessDecision.deny(FailureCode.PROTECTED_ROLE);
        }
        return AccessDecision.allow();
    }
}
