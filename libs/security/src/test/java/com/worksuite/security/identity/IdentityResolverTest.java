package com.worksuite.security.identity;

import com.worksuite.security.AuthenticationException;
import com.worksuite.security.FailureCode;
import com.worksuite.security.testing.InMemoryIdentityStore;
import com.worksuite.security.testing.TestAuthorizationContextFactory;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("IdentityResolver")
class IdentityResolverTest {

    private final InMemoryIdentityStore store = new InMemoryIdentityStore();
    private final IdentityResolver resolver = new IdentityResolver(store, SchemaCapabilities.full());

    @Test
    @DisplayName("returns the active user")
    void activeUser() {
        store.add(TestAuthorizationContextFactory.identity(5L, "manager"));

        Identity identity = resolver.resolve(5L);

        assertThat(identity.id()).isEqualTo(5L);
        assertThat(identity.legacyRole()).isEqualTo("manager");
    }

    @Test
    @DisplayName("unknown user fails with IDENTITY_NOT_FOUND")
    void unknownUser() {
        assertThatThrownBy(() -> resolver.resolve(404L))
                .isInstanceOfSatisfying(AuthenticationException.class,
                        e -> assertThat(e.code()).isEqualTo(FailureCode.IDENTITY_NOT_FOUND));
    }

    @Test
    @DisplayName("deactivated user fails with IDENTITY_DEACTIVATED")
    void deactivated() {
        store.add(new Identity(6L, "gone", "gone@worksuite.test", "Gone", false, "viewer",
                null, false, null, null));

        assertThatThrownBy(() -> resolver.resolve(6L))
                .isInstanceOfSatisfying(AuthenticationException.class,
                        e -> assertThat(e.code()).isEqualTo(FailureCode.IDENTITY_DEACTIVATED));
    }

    @Test
    @DisplayName("reduced identity from a legacy schema still resolves")
    void legacySchema() {
        IdentityResolver legacy = new IdentityResolver(store, SchemaCapabilities.legacy());
        store.add(new Identity(7L, "old", "old@worksuite.test", "Old", true, "viewer",
                null, false, null, null));

        Identity identity = legacy.resolve(7L);

        assertThat(identity.tenant()).isEmpty();
        assertThat(identity.superAdmin()).isFalse();
        assertThat(identity.emailVerified()).isNull();
        assertThat(legacy.capabilities().isComplete()).isFalse();
    }
}
