package com.didvault.api.config;

import com.didvault.api.audit.RegistryAuditLog;
import com.didvault.registry.DidRegistry;
import com.didvault.registry.OrphanedStatePolicy;
import com.didvault.registry.RegistrySettings;
import com.didvault.registry.store.RegistryStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration for the identity registry.
 */
@Configuration
@ConfigurationProperties(prefix = "didvault.registry")
public class RegistryConfig {

    private static final Logger log = LoggerFactory.getLogger(RegistryConfig.class);

    private OrphanedStatePolicy orphanedStatePolicy = OrphanedStatePolicy.PRESERVE;

    public OrphanedStatePolicy getOrphanedStatePolicy() { return orphanedStatePolicy; }
    public void setOrphanedStatePolicy(OrphanedStatePolicy policy) { this.orphanedStatePolicy = policy; }

    @Bean
    public DidRegistry didRegistry(RegistryAuditLog auditLog) {
        log.info("Identity registry starting with {} orphaned-state policy", orphanedStatePolicy);
        DidRegistry registry = new DidRegistry(new RegistryStore(), new RegistrySettings(orphanedStatePolicy));
        registry.addListener(event -> {
            // The change is already committed; a lost audit entry must not fail the request
            try {
                auditLog.onEvent(event);
            } catch (RuntimeException e) {
                log.warn("Audit log failed to record committed {} for {}", event.type(), event.subject(), e);
            }
        });
        return registry;
    }
}
