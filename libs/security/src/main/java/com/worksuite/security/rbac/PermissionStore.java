package com.worksuite.security.rbac;

import java.util.Collection;
import java.util.List;

/**
 * Read access to permissions granted through roles.
 */
public interface PermissionStore {

    /**
     * Distinct permissions granted by any of the given roles.
     *
     * @param roleIds role ids; an empty collection yields an empty list
     */
    List<PermissionRecord> findByRoleIds(Collection<Long> roleIds);
}
