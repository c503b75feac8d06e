package com.streamfirst.mindmap.retention.boot;

import com.streamfirst.mindmap.retention.adapters.InMemoryPlanTierAdapter;
import com.streamfirst.mindmap.retention.adapters.InMemorySnapshotStoreAdapter;
import com.streamfirst.mindmap.retention.application.RetentionService;
import com.streamfirst.mindmap.retention.domain.MapId;
import com.streamfirst.mindmap.retention.domain.SnapshotId;
import com.streamfirst.mindmap.retention.domain.SnapshotMetadata;
import com.streamfirst.mindmap.retention.domain.UserId;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Seeds one free-tier user past quota and runs a sweep, logging each step.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "mindmap.retention", name = "demo", havingValue = "true")
public class RetentionDemoRunner implements CommandLineRunner {

    private static final long MB = 1024L * 1024L;

    private final RetentionService retentionService;
    private final InMemorySnapshotStoreAdapter snapshotStore;
    private final InMemoryPlanTierAdapter planTiers;
    private final Clock clock;

    @Override
    public void run(String... args) {
        log.info("--- Starting snapshot retention demo ---");

        UserId user = UserId.of("demo-user");
        MapId map = MapId.of("demo-map");
        Instant now = clock.instant();
        planTiers.setTier(user, "free");

        int[] agesInDays = {1, 5, 10, 40, 90};
        for (int age : agesInDays) {
            snapshotStore.save(user, SnapshotMetadata.builder()
                .id(SnapshotId.of("snap-" + age + "d"))
                .createdAt(now.minus(Duration.ofDays(age)))
                .sizeBytes(30 * MB)
                .mapId(map)
                .actionName("Auto-save")
                .build());
        }
        log.info("Seeded {} snapshots, {} bytes in use", agesInDays.length, snapshotStore.getTotalBytes(user));

        retentionService.enforceAll(List.of(user)).forEach((userId, result) -> {
            if (result.isSuccess()) {
                var run = result.orElseThrow();
                log.info("User {}: status={}, evicted={}", userId, run.getStatus(), run.getPlan().getEvictions());
            } else {
                log.warn("User {}: {}", userId, result);
            }
        });

        log.info("--- Demo finished, {} bytes in use ---", snapshotStore.getTotalBytes(user));
    }
}
