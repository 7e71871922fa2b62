package com.worksuite.security.testing;

import com.worksuite.security.rbac.Action;
import com.worksuite.security.rbac.Module;
import com.worksuite.security.rbac.Permission;
import com.worksuite.security.rbac.PermissionRecord;
import com.worksuite.security.rbac.PermissionStore;
import com.worksuite.security.rbac.Role;
import com.worksuite.security.rbac.RoleStore;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Roles, assignments and role permissions held in memory. Implements both {@link RoleStore} and
 * {@link PermissionStore} so tests configure RBAC in one place.
 */
public class InMemoryRoleStore implements RoleStore, PermissionStore {

    private final Map<Long, Role> roles = new ConcurrentHashMap<>();
    private final Map<Long, Set<Long>> assignments = new ConcurrentHashMap<>();
    private final Map<Long, List<PermissionRecord>> grants = new ConcurrentHashMap<>();
    private final AtomicLong permissionIds = new AtomicLong();

    public InMemoryRoleStore addRole(Role role) {
        roles.put(role.id(), role);
        return this;
    }

    public InMemoryRoleStore assign(long userId, long roleId) {
        assignments.computeIfAbsent(userId, id -> new TreeSet<>()).add(roleId);
        return this;
    }

    public InMemoryRoleStore grant(long roleId, Module module, Action action) {
        return grantRaw(roleId, module.value(), action.value());
    }

    public InMemoryRoleStore grant(long roleId, Permission permission) {
        return grant(roleId, permission.module(), permission.action());
    }

    /** Grants a permission row with arbitrary stored values, including unknown ones. */
    public InMemoryRoleStore grantRaw(long roleId, String module, String action) {
        grants.computeIfAbsent(roleId, id -> new CopyOnWriteArrayList<>())
                .add(new PermissionRecord(permissionIds.incrementAndGet(), module, action, null));
        return this;
    }

    @Override
    public List<Role> findAssignedRoles(long userId) {
        List<Role> result = new ArrayList<>();
        for (Long roleId : assignments.getOrDefault(userId, Set.of())) {
            Role role = roles.get(roleId);
            if (role != null) {
                result.add(role);
            }
        }
        result.sort(Comparator.comparingLong(Role::id));
        return result;
    }

    @Override
    public Optional<Role> findByName(String name) {
        return roles.values().stream().filter(r -> r.name().equals(name)).findFirst();
    }

    @Override
    public Optional<Role> findById(long roleId) {
        return Optional.ofNullable(roles.get(roleId));
    }

    @Override
    public List<PermissionRecord> findByRoleIds(Collection<Long> roleIds) {
        Map<String, PermissionRecord> distinct = new LinkedHashMap<>();
        for (Long roleId : roleIds) {
            for (PermissionRecord record : grants.getOrDefault(roleId, List.of())) {
                distinct.putIfAbsent(record.module() + "." + record.action(), record);
            }
        }
        return List.copyOf(distinct.values());
    }
}
