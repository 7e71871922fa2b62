package com.worksuite.security.identity;

import java.util.Optional;

/** Read access to user records. */
public interface IdentityStore {

    /**
     * Loads a user by id, including inactive users.
     *
     * @return the user, or empty when no row exists
     */
    Optional<Identity> findById(long userId);
}
