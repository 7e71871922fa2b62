package com.worksuite.security.rbac;

import java.util.List;
import java.util.Optional;

/**
 * Read access to roles and user-role assignments.
 */
public interface RoleStore {

    /** Roles explicitly assigned to the user, in role id order. */
    List<Role> findAssignedRoles(long userId);

    /** Role with the given machine name. */
    Optional<Role> findByName(String name);

    /** Role with the given id. */
    Optional<Role> findById(long roleId);
}
