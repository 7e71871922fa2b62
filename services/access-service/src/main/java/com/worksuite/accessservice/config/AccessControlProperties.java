package com.worksuite.accessservice.config;

import com.worksuite.security.credential.CredentialSettings;
import com.worksuite.workgraph.DependencyGraphValidator;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.List;

/**
 * Access control settings, bound from {@code worksuite.access.*}.
 *
 * <pre>
 * worksuite:
 *   access:
 *     jwt-secret: ${JWT_SECRET}
 *     jwt-issuer: worksuite
 *     token-expiry: 7d
 *     max-dependency-depth: 10
 *     store: jdbc
 * </pre>
 *
 * @param jwtSecret HMAC signing secret, at least 32 characters. Required.
 * @param jwtIssuer issuer written to and required on every token
 * @param tokenExpiry credential lifetime (default 7 days)
 * @param maxDependencyDepth edge limit of the dependency cycle search (default 10)
 * @param store where the engine reads users, roles, workspaces and links from
 * @param corsOrigins browser origins allowed to call {@code /api/**}
 */
@ConfigurationProperties(prefix = "worksuite.access")
@Validated
public record AccessControlProperties(
        @NotBlank @Size(min = 32) String jwtSecret,
        String jwtIssuer,
        Duration tokenExpiry,
        @Min(1) int maxDependencyDepth,
        StoreMode store,
        List<String> corsOrigins) {

    /** Backing store for the engine's read models. */
    public enum StoreMode {
        /** PostgreSQL through the JDBC adapters. */
        JDBC,
        /** Process-local maps, for tests and demos. */
        MEMORY
    }

    public AccessControlProperties {
        if (jwtIssuer == null || jwtIssuer.isBlank()) {
            jwtIssuer = CredentialSettings.DEFAULT_ISSUER;
        }
        if (tokenExpiry == null) {
            tokenExpiry = CredentialSettings.DEFAULT_EXPIRY;
        }
        if (maxDependencyDepth <= 0) {
            maxDependencyDepth = DependencyGraphValidator.DEFAULT_MAX_DEPTH;
        }
        if (store == null) {
            store = StoreMode.JDBC;
        }
        corsOrigins = corsOrigins == null ? List.of() : List.copyOf(corsOrigins);
    }

    public CredentialSettings credentialSettings() {
        return new CredentialSettings(jwtSecret, jwtIssuer, tokenExpiry);
    }
}
