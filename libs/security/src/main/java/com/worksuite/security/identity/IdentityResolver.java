package com.worksuite.security.identity;

import com.worksuite.security.AuthenticationException;
import com.worksuite.security.FailureCode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns a verified subject id into an active {@link Identity}.
 * <p>
 * Unknown and deactivated users are terminal authentication failures. When the schema lacks
 * optional columns the store returns a reduced identity; that is logged at debug level and the
 * request proceeds.
 */
public class IdentityResolver {

    private static final Logger log = LoggerFactory.getLogger(IdentityResolver.class);

    private final IdentityStore store;
    private final SchemaCapabilities capabilities;

    public IdentityResolver(IdentityStore store, SchemaCapabilities capabilities) {
        this.store = store;
        this.capabilities = capabilities;
    }

    /**
     * Loads and checks the identity behind a credential subject.
     *
     * @throws AuthenticationException {@code IDENTITY_NOT_FOUND} or {@code IDENTITY_DEACTIVATED}
     */
    public Identity resolve(long subjectId) {
        Identity identity =
                store.findById(subjectId)
                        .orElseThrow(
                                () -> new AuthenticationException(FailureCode.IDENTITY_NOT_FOUND));
        if (!identity.active()) {
            log.info("Rejected deactivated user {}", subjectId);
            throw new AuthenticationException(FailureCode.IDENTITY_DEACTIVATED);
        }
        if (!capabilities.isComplete()) {
            log.debug("User {} loaded from a reduced schema: {}", subjectId, capabilities);
        }
        return identity;
    }

    public SchemaCapabilities capabilities() {
        return capabilities;
    }
}
