package com.streamfirst.mindmap.retention.boot;

import com.streamfirst.mindmap.retention.adapters.InMemoryPlanTierAdapter;
import com.streamfirst.mindmap.retention.adapters.InMemorySnapshotStoreAdapter;
import com.streamfirst.mindmap.retention.application.*;
import com.streamfirst.mindmap.retention.domain.PlanTier;
import com.streamfirst.mindmap.retention.ports.PlanTierPort;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Wires the retention engine to its collaborators.
 *
 * <p>The in-memory store and billing adapters stand in for the real storage and subscription
 * services; production deployments replace those two beans.
 */
@Slf4j
@Configuration
@EnableConfigurationProperties(RetentionProperties.class)
public class RetentionAppConfiguration {

    // --- Engine ---

    @Bean
    public PolicyCatalog policyCatalog(RetentionProperties properties) {
        PolicyCatalog catalog = properties.toCatalog();
        log.info("Loaded retention policies: {}", catalog);
        return catalog;
    }

    @Bean
    public EvictionOrchestrator evictionOrchestrator(PolicyCatalog policyCatalog) {
        return EvictionOrchestrator.withCatalog(policyCatalog);
    }

    @Bean
    public Clock retentionClock() {
        return Clock.systemUTC();
    }

    // --- Collaborator adapters (in-memory) ---

    @Bean
    public InMemoryPlanTierAdapter planTierAdapter() {
        return new InMemoryPlanTierAdapter();
    }

    @Bean
    public InMemorySnapshotStoreAdapter snapshotStoreAdapter(PolicyCatalog policyCatalog, PlanTierPort planTierAdapter) {
        // the store's usage row reports the quota of whatever tier billing currently says
        return new InMemorySnapshotStoreAdapter(
            userId -> policyCatalog.policyFor(PlanTier.fromCode(planTierAdapter.currentTier(userId))).storageQuota());
    }

    // --- Application service ---

    @Bean
    public RetentionService retentionService(InMemoryPlanTierAdapter planTierAdapter,
                                             InMemorySnapshotStoreAdapter snapshotStoreAdapter,
                                             EvictionOrchestrator evictionOrchestrator,
                                             Clock retentionClock) {
        return new RetentionService(
            planTierAdapter, snapshotStoreAdapter, snapshotStoreAdapter, snapshotStoreAdapter,
            evictionOrchestrator, retentionClock);
    }
}
