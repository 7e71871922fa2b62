package com.worksuite.accessservice.config;

import com.worksuite.accessservice.config.AccessControlProperties.StoreMode;
import com.worksuite.security.credential.CredentialSettings;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("AccessControlProperties")
class AccessControlPropertiesTest {

    private static final String SECRET = "0123456789abcdef0123456789abcdef";

    @Test
    @DisplayName("applies defaults for optional settings")
    void defaults() {
        var props = new AccessControlProperties(SECRET, null, null, 0, null, null);

        assertThat(props.jwtIssuer()).isEqualTo("worksuite");
        assertThat(props.tokenExpiry()).isEqualTo(Duration.ofDays(7));
        assertThat(props.maxDependencyDepth()).isEqualTo(10);
        assertThat(props.store()).isEqualTo(StoreMode.JDBC);
        assertThat(props.corsOrigins()).isEmpty();
    }

    @Test
    @DisplayName("keeps explicit settings")
    void explicitValues() {
        var props =
                new AccessControlProperties(
                        SECRET, "acme", Duration.ofHours(1), 4, StoreMode.MEMORY, List.of("https://app.acme.test"));

        assertThat(props.jwtIssuer()).isEqualTo("acme");
        assertThat(props.tokenExpiry()).isEqualTo(Duration.ofHours(1));
        assertThat(props.maxDependencyDepth()).isEqualTo(4);
        assertThat(props.store()).isEqualTo(StoreMode.MEMORY);
        assertThat(props.corsOrigins()).containsExactly("https://app.acme.test");
    }

    @Test
    @DisplayName("credential settings carry the issuer and expiry")
    void credentialSettings() {
        CredentialSettings settings =
                new AccessControlProperties(SECRET, "acme", Duration.ofHours(2), 0, null, null)
                        .credentialSettings();

        assertThat(settings.issuer()).isEqualTo("acme");
        assertThat(settings.tokenExpiry()).isEqualTo(Duration.ofHours(2));
        assertThat(settings.toString()).doesNotContain(SECRET);
    }
}
