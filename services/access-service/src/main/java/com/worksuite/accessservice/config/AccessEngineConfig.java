package com.worksuite.accessservice.config;

import com.worksuite.observability.AccessMetrics;
import com.worksuite.security.AccessDecisionPoint;
import com.worksuite.security.AuthorizationEngine;
import com.worksuite.security.credential.CredentialSettings;
import com.worksuite.security.credential.CredentialVerifier;
import com.worksuite.security.credential.TokenIssuer;
import com.worksuite.security.identity.IdentityResolver;
import com.worksuite.security.identity.IdentityStore;
import com.worksuite.security.identity.SchemaCapabilities;
import com.worksuite.security.rbac.PermissionResolver;
import com.worksuite.security.rbac.PermissionStore;
import com.worksuite.security.rbac.RoleResolver;
import com.worksuite.security.rbac.RoleStore;
import com.worksuite.security.tenant.SubscriptionGate;
import com.worksuite.security.tenant.TenantResolver;
import com.worksuite.security.tenant.WorkspaceStore;
import com.worksuite.workgraph.DependencyGraphValidator;
import com.worksuite.workgraph.TaskLinkService;
import com.worksuite.workgraph.TaskLinkStore;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Wires the engine components over whichever store beans the active store configuration
 * provides.
 */
@Configuration
public class AccessEngineConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public CredentialSettings credentialSettings(AccessControlProperties properties) {
        return properties.credentialSettings();
    }

    @Bean
    public TokenIssuer tokenIssuer(CredentialSettings settings, Clock clock) {
        return new TokenIssuer(settings, clock);
    }

    @Bean
    public CredentialVerifier credentialVerifier(CredentialSettings settings, Clock clock) {
        return new CredentialVerifier(settings, clock);
    }

    @Bean
    public IdentityResolver identityResolver(IdentityStore identityStore, SchemaCapabilities capabilities) {
        return new IdentityResolver(identityStore, capabilities);
    }

    @Bean
    public RoleResolver roleResolver(RoleStore roleStore) {
        return new RoleResolver(roleStore);
    }

    @Bean
    public PermissionResolver permissionResolver(PermissionStore permissionStore) {
        return new PermissionResolver(permissionStore);
    }

    @Bean
    public TenantResolver tenantResolver(WorkspaceStore workspaceStore) {
        return new TenantResolver(workspaceStore);
    }

    @Bean
    public SubscriptionGate subscriptionGate(Clock clock) {
        return new SubscriptionGate(clock);
    }

    @Bean
    public AuthorizationEngine authorizationEngine(
            CredentialVerifier credentialVerifier,
            IdentityResolver identityResolver,
            RoleResolver roleResolver,
            PermissionResolver permissionResolver,
            TenantResolver tenantResolver,
            SubscriptionGate subscriptionGate) {
        return new AuthorizationEngine(
                credentialVerifier,
                identityResolver,
                roleResolver,
                permissionResolver,
                tenantResolver,
                subscriptionGate);
    }

    @Bean
    public AccessDecisionPoint accessDecisionPoint(
            WorkspaceStore workspaceStore, SubscriptionGate subscriptionGate) {
        return new AccessDecisionPoint(workspaceStore, subscriptionGate);
    }

    @Bean
    public DependencyGraphValidator dependencyGraphValidator(
            TaskLinkStore taskLinkStore, AccessControlProperties properties) {
        return new DependencyGraphValidator(taskLinkStore, properties.maxDependencyDepth());
    }

    @Bean
    public TaskLinkService taskLinkService(
            TaskLinkStore taskLinkStore, DependencyGraphValidator validator) {
        return new TaskLinkService(taskLinkStore, validator);
    }

    @Bean
    public AccessMetrics accessMetrics(
            MeterRegistry registry, @Value("${spring.application.name}") String serviceName) {
        return new AccessMetrics(registry, serviceName);
    }
}
