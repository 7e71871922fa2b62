package com.worksuite.accessservice.config;

import com.worksuite.security.identity.SchemaCapabilities;
import com.worksuite.security.testing.InMemoryIdentityStore;
import com.worksuite.security.testing.InMemoryRoleStore;
import com.worksuite.security.testing.InMemoryWorkspaceStore;
import com.worksuite.workgraph.testing.InMemoryTaskLinkStore;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Process-local stores, selected with {@code worksuite.access.store=memory}. They start empty;
 * callers seed them through the bean types.
 */
@Configuration
@ConditionalOnProperty(prefix = "worksuite.access", name = "store", havingValue = "memory")
public class InMemoryStoreConfig {

    @Bean
    public SchemaCapabilities schemaCapabilities() {
        return SchemaCapabilities.full();
    }

    @Bean
    public InMemoryIdentityStore identityStore() {
        return new InMemoryIdentityStore();
    }

    /** Serves both the role and the permission store interfaces. */
    @Bean
    public InMemoryRoleStore roleStore() {
        return new InMemoryRoleStore();
    }

    @Bean
    public InMemoryWorkspaceStore workspaceStore() {
        return new InMemoryWorkspaceStore();
    }

    @Bean
    public InMemoryTaskLinkStore taskLinkStore() {
        return new InMemoryTaskLinkStore();
    }
}
