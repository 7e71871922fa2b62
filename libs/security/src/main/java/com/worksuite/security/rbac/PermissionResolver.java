package com.worksuite.security.rbac;

import com.worksuite.security.FailureCode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.Collections;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Expands role ids into the flattened, ordered set of permission grants.
 * <p>
 * Reads the store on every call. Rows whose module or action is not recognised are logged and
 * skipped.
 */
public class PermissionResolver {

    private static final Logger log = LoggerFactory.getLogger(PermissionResolver.class);

    private final PermissionStore store;

    public PermissionResolver(PermissionStore store) {
        this.store = store;
    }

    /**
     * @param roleIds role ids to expand, may be empty
     * @return unmodifiable set ordered by (module, action)
     */
    public SortedSet<Permission> resolve(Collection<Long> roleIds) {
        if (roleIds == null || roleIds.isEmpty()) {
            return Collections.emptySortedSet();
        }
        TreeSet<Permission> grants = new TreeSet<>();
        for (PermissionRecord record : store.findByRoleIds(roleIds)) {
            Permission.fromValues(record.module(), record.action())
                    .ifPresentOrElse(grants::add, () -> log.warn(
                            "{}: skipping permission {} ({}.{})",
                            FailureCode.UNKNOWN_PERMISSION.value(),
                            record.id(), record.module(), record.action()));
        }
        return Collections.unmodifiableSortedSet(grants);
    }
}
