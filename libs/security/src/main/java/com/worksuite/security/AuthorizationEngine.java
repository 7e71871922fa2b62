package com.worksuite.security;

import com.worksuite.security.credential.CredentialVerifier;
import com.worksuite.security.credential.VerifiedCredential;
import com.worksuite.security.identity.Identity;
import com.worksuite.security.identity.IdentityResolver;
import com.worksuite.security.rbac.LegacyRole;
import com.worksuite.security.rbac.Permission;
import com.worksuite.security.rbac.PermissionResolver;
import com.worksuite.security.rbac.RoleResolution;
import com.worksuite.security.rbac.RoleResolver;
import com.worksuite.security.tenant.SubscriptionGate;
import com.worksuite.security.tenant.TenantResolution;
import com.worksuite.security.tenant.TenantResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.SortedSet;

/**
 * Builds the {@link AuthorizationContext} for a request.
 * <p>
 * Pipeline: verify credential, load identity, resolve roles, expand permissions, resolve tenant,
 * evaluate the subscription gate. Authentication failures come back as an
 * {@link AuthenticationResult}; storage failures are not caught and reach the caller unchanged.
 * Nothing is cached between calls.
 */
public class AuthorizationEngine {

    private static final Logger log = LoggerFactory.getLogger(AuthorizationEngine.class);

    private final CredentialVerifier credentialVerifier;
    private final IdentityResolver identityResolver;
    private final RoleResolver roleResolver;
    private final PermissionResolver permissionResolver;
    private final TenantResolver tenantResolver;
    private final SubscriptionGate subscriptionGate;

    public AuthorizationEngine(
            CredentialVerifier credentialVerifier,
            IdentityResolver identityResolver,
            RoleResolver roleResolver,
            PermissionResolver permissionResolver,
            TenantResolver tenantResolver,
            SubscriptionGate subscriptionGate) {
        this.credentialVerifier = credentialVerifier;
        this.identityResolver = identityResolver;
        this.roleResolver = roleResolver;
        this.permissionResolver = permissionResolver;
        this.tenantResolver = tenantResolver;
        this.subscriptionGate = subscriptionGate;
    }

    /**
     * Authenticates a raw {@code Authorization} header value.
     */
    public AuthenticationResult authenticateHeader(String authorizationHeader) {
        return BearerTokenExtractor.extract(authorizationHeader)
                .map(this::authenticate)
                .orElseGet(() -> AuthenticationResult.failure(FailureCode.MISSING_CREDENTIAL, null));
    }

    /**
     * Authenticates a bare token.
     */
    public AuthenticationResult authenticate(String token) {
        try {
            return AuthenticationResult.success(buildContext(token));
        } catch (AuthenticationException e) {
            log.debug("Authentication failed: {}", e.code().value());
            return AuthenticationResult.failure(e.code(), e.getMessage());
        }
    }

    private AuthorizationContext buildContext(String token) {
        VerifiedCredential credential = credentialVerifier.verify(token);
        Identity identity = identityResolver.resolve(credential.subjectId());

        RoleResolution roles = roleResolver.resolve(identity);
        SortedSet<Permission> permissions = permissionResolver.resolve(roles.roleIds());

        TenantResolution tenant = tenantResolver.resolve(identity, credential.tenantHint());
        if (tenant.workspace() != null) {
            identity = identity.withTenantId(tenant.workspaceId());
        }

        boolean allAccess = roles.includesProtectedRole()
                || LegacyRole.fromLabel(identity.legacyRole()).filter(r -> r == LegacyRole.ADMIN).isPresent();

        return new AuthorizationContext(
                identity,
                roles.roleIds(),
                permissions,
                tenant.workspace(),
                tenant.role(),
                identity.superAdmin(),
                allAccess,
                subscriptionGate.evaluate(tenant));
    }
}
