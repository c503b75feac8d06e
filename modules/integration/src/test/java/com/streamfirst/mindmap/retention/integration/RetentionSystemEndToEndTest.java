package com.streamfirst.mindmap.retention.integration;

import com.streamfirst.mindmap.retention.adapters.InMemoryPlanTierAdapter;
import com.streamfirst.mindmap.retention.adapters.InMemorySnapshotStoreAdapter;
import com.streamfirst.mindmap.retention.application.EvictionOrchestrator;
import com.streamfirst.mindmap.retention.application.PolicyCatalog;
import com.streamfirst.mindmap.retention.application.RetentionService;
import com.streamfirst.mindmap.retention.domain.*;
import lombok.extern.slf4j.Slf4j;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * End-to-end test of the retention pipeline over the in-memory store and billing adapters.
 * Covers quota enforcement, retry-to-convergence after partial deletion failure, tier upgrades
 * and time-driven staleness.
 */
@Slf4j
public class RetentionSystemEndToEndTest {

    private static final long MB = 1024L * 1024L;
    private static final Instant START = Instant.parse("2026-03-01T00:00:00Z");
    private static final UserId ALICE = UserId.of("alice");
    private static final MapId ROADMAP = MapId.of("roadmap");

    private PolicyCatalog catalog;
    private MutableClock clock;
    private InMemoryPlanTierAdapter tiers;
    private InMemorySnapshotStoreAdapter store;
    private RetentionService service;

    @BeforeEach
    void setupPipeline() {
        catalog = PolicyCatalog.defaults();
        clock = new MutableClock(START, ZoneOffset.UTC);
        tiers = new InMemoryPlanTierAdapter();
        store = new InMemorySnapshotStoreAdapter(
            userId -> catalog.policyFor(PlanTier.fromCode(tiers.currentTier(userId))).storageQuota());
        service = new RetentionService(
            tiers, store, store, store, EvictionOrchestrator.withCatalog(catalog), clock);

        log.info("Retention pipeline ready with {}", catalog);
    }

    private void seed(UserId user, String id, int ageDays, boolean major, long size) {
        store.save(user, SnapshotMetadata.builder()
            .id(SnapshotId.of(id))
            .createdAt(clock.instant().minus(Duration.ofDays(ageDays)))
            .major(major)
            .sizeBytes(size)
            .mapId(ROADMAP)
            .actionName(major ? "Manual Checkpoint" : "Auto-save")
            .build());
    }

    @Test
    void testFreeUserOverQuotaIsBroughtBackUnderAndStaysThere() {
        for (int age : new int[] {1, 5, 10, 40, 90}) {
            seed(ALICE, "d" + age, age, false, 30 * MB);
        }
        assertEquals(150 * MB, store.getTotalBytes(ALICE));

        RetentionRun first = service.enforceQuota(ALICE).orElseThrow();
        log.debug("First run: {}", first);

        assertEquals(RetentionStatus.RECLAIMED, first.getStatus());
        assertEquals(List.of(SnapshotId.of("d90"), SnapshotId.of("d40")), first.getPlan().getEvictions());
        assertEquals(90 * MB, store.getTotalBytes(ALICE));

        RetentionRun second = service.enforceQuota(ALICE).orElseThrow();

        assertEquals(RetentionStatus.COMPLIANT, second.getStatus());
        assertTrue(second.getPlan().isEmpty(), "Second run should plan nothing");
    }

    @Test
    void testPartialDeletionFailureConvergesOnRerun() {
        for (int age : new int[] {1, 5, 10, 40, 90}) {
            seed(ALICE, "d" + age, age, false, 30 * MB);
        }
        store.failDeletionOf(SnapshotId.of("d40"));

        RetentionRun first = service.enforceQuota(ALICE).orElseThrow();

        assertEquals(RetentionStatus.PARTIAL_DELETION_FAILURE, first.getStatus());
        assertEquals(List.of(SnapshotId.of("d40")), first.getDeletion().failed());
        assertEquals(30 * MB, first.getReclaimedBytes());
        assertEquals(120 * MB, store.getTotalBytes(ALICE));

        store.allowDeletion(SnapshotId.of("d40"));
        RetentionRun retry = service.enforceQuota(ALICE).orElseThrow();

        assertEquals(RetentionStatus.RECLAIMED, retry.getStatus());
        assertEquals(List.of(SnapshotId.of("d40")), retry.getPlan().getEvictions());
        assertEquals(90 * MB, store.getTotalBytes(ALICE));
    }

    @Test
    void testUsageOutageFailsWithoutDeleting() {
        seed(ALICE, "d90", 90, false, 200 * MB);
        store.failUsageQuery(ALICE);

        Result<RetentionRun> result = service.enforceQuota(ALICE);

        assertTrue(result.hasErrorCode(RetentionErrorCode.QUOTA_DATA_UNAVAILABLE));
        assertEquals(200 * MB, store.getTotalBytes(ALICE));
    }

    @Test
    void testUpgradeToProRaisesQuotaAndStopsEviction() {
        seed(ALICE, "big", 10, false, 150 * MB);
        tiers.setTier(ALICE, "pro");

        RetentionRun run = service.enforceQuota(ALICE).orElseThrow();

        assertEquals(RetentionStatus.COMPLIANT, run.getStatus());
        assertEquals(PlanTier.PRO, run.getPlan().getTier());
        assertEquals(150 * MB, store.getTotalBytes(ALICE));
    }

    @Test
    void testFailedCheckpointDeletionIsReportedAsPartialFailure() {
        seed(ALICE, "checkpoint-a", 2, true, 60 * MB);
        seed(ALICE, "checkpoint-b", 1, true, 60 * MB);
        store.failDeletionOf(SnapshotId.of("checkpoint-a"));
        store.failDeletionOf(SnapshotId.of("checkpoint-b"));

        RetentionRun run = service.enforceQuota(ALICE).orElseThrow();

        assertEquals(EvictionOutcome.SATISFIED, run.getPlan().getOutcome());
        assertEquals(RetentionStatus.PARTIAL_DELETION_FAILURE, run.getStatus());
        assertEquals(120 * MB, store.getTotalBytes(ALICE));
    }

    @Test
    void testCheckpointsOutliveAutoSavesAsTimePasses() {
        seed(ALICE, "auto", 0, false, MB);
        seed(ALICE, "checkpoint", 0, true, MB);

        clock.advance(Duration.ofDays(31));
        RetentionRun afterMonth = service.purgeStale(ALICE).orElseThrow();
        assertEquals(List.of(SnapshotId.of("auto")), afterMonth.getDeletion().deleted());

        clock.advance(Duration.ofDays(29));
        RetentionRun atTwoMaxAges = service.purgeStale(ALICE).orElseThrow();
        assertEquals(RetentionStatus.COMPLIANT, atTwoMaxAges.getStatus());

        clock.advance(Duration.ofMillis(1));
        RetentionRun pastTwoMaxAges = service.purgeStale(ALICE).orElseThrow();
        assertEquals(List.of(SnapshotId.of("checkpoint")), pastTwoMaxAges.getDeletion().deleted());
        assertTrue(store.listSnapshots(ALICE).isEmpty());
    }

    @Test
    void testUnknownTierIsRejected() {
        seed(ALICE, "d90", 90, false, 200 * MB);
        tiers.setTier(ALICE, "platinum");

        Result<RetentionRun> result = service.enforceQuota(ALICE);

        assertTrue(result.hasErrorCode(RetentionErrorCode.INVALID_POLICY_TIER));
        assertEquals(200 * MB, store.getTotalBytes(ALICE));
    }
}
