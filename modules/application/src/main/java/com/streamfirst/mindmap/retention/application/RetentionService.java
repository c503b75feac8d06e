package com.streamfirst.mindmap.retention.application;

import com.streamfirst.mindmap.retention.domain.*;
import com.streamfirst.mindmap.retention.ports.*;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Instant;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Runs the retention pipeline for a user against the storage and billing collaborators.
 *
 * <p>Each run reads the tier, the usage row and the inventory once, asks the
 * {@link EvictionOrchestrator} for a plan, then executes it through the deletion port. Every
 * failure mode comes back as a typed {@link Result} or {@link RetentionStatus}; nothing is retried
 * inside a run. Re-running after a partial failure converges because deleted snapshots vanish from
 * the next inventory.
 */
@Slf4j
@RequiredArgsConstructor
public class RetentionService {

    private final PlanTierPort planTierPort;
    private final UsagePort usagePort;
    private final SnapshotInventoryPort inventoryPort;
    private final SnapshotDeletionPort deletionPort;
    private final EvictionOrchestrator orchestrator;
    private final Clock clock;

    /**
     * Brings the user's snapshot storage back under quota.
     *
     * @param userId the user to enforce
     * @return the run record, or a failure tagged {@link RetentionErrorCode#INVALID_POLICY_TIER}
     *     or {@link RetentionErrorCode#QUOTA_DATA_UNAVAILABLE}
     */
    public Result<RetentionRun> enforceQuota(UserId userId) {
        log.debug("Enforcing snapshot quota for user {}", userId);
        return resolveTier(userId).flatMap(tier -> enforceQuota(userId, tier));
    }

    /**
     * Deletes every stale snapshot the user owns, whether or not they are over quota.
     *
     * @param userId the user to sweep
     * @return the run record, or a failure tagged {@link RetentionErrorCode#INVALID_POLICY_TIER}
     *     or {@link RetentionErrorCode#QUOTA_DATA_UNAVAILABLE}
     */
    public Result<RetentionRun> purgeStale(UserId userId) {
        log.debug("Purging stale snapshots for user {}", userId);
        return resolveTier(userId).flatMap(tier -> purgeStale(userId, tier));
    }

    /**
     * Enforces quota for each user in turn. A failure for one user is recorded and the sweep moves
     * on.
     */
    public Map<UserId, Result<RetentionRun>> enforceAll(Collection<UserId> userIds) {
        log.info("Starting quota sweep over {} users", userIds.size());

        Map<UserId, Result<RetentionRun>> results = new LinkedHashMap<>();
        for (UserId userId : userIds) {
            try {
                results.put(userId, enforceQuota(userId));
            } catch (RuntimeException e) {
                log.error("Quota enforcement failed for user {}", userId, e);
                results.put(userId, Result.failure("Quota enforcement failed for user " + userId + ": " + e.getMessage()));
            }
        }

        long failed = results.values().stream().filter(Result::isFailure).count();
        log.info("Quota sweep finished: {} users, {} failed", results.size(), failed);
        return results;
    }

    private Result<RetentionRun> enforceQuota(UserId userId, PlanTier tier) {
        return readUsage(userId).map(usage -> {
            Instant now = clock.instant();
            List<SnapshotMetadata> inventory = inventoryPort.listSnapshots(userId);
            EvictionPlan plan = orchestrator.plan(userId, inventory, tier, usage, now);

            RetentionRun run = execute(plan, inventory);
            logRun("Quota enforcement", run);
            return run;
        });
    }

    private Result<RetentionRun> purgeStale(UserId userId, PlanTier tier) {
        return readUsage(userId).map(usage -> {
            Instant now = clock.instant();
            List<SnapshotMetadata> inventory = inventoryPort.listSnapshots(userId);
            EvictionPlan plan = orchestrator.purgePlan(userId, inventory, tier, usage, now);

            RetentionRun run = execute(plan, inventory);
            logRun("Stale purge", run);
            return run;
        });
    }

    private Result<Optional<UsageSnapshot>> readUsage(UserId userId) {
        try {
            return Result.success(usagePort.aggregateUsage(userId).map(this::toUsageSnapshot));
        } catch (UsageQueryException e) {
            log.error("Usage query failed for user {}", e.getUserId(), e);
            return Result.failure("Usage data unavailable for user " + userId + ": " + e.getMessage(),
                                  RetentionErrorCode.QUOTA_DATA_UNAVAILABLE);
        }
    }

    private Result<PlanTier> resolveTier(UserId userId) {
        String code = planTierPort.currentTier(userId);
        try {
            return Result.success(PlanTier.fromCode(code));
        } catch (InvalidPolicyTierException e) {
            log.warn("User {} has unknown plan tier '{}'", userId, e.getTierCode());
            return Result.failure(e.getMessage(), RetentionErrorCode.INVALID_POLICY_TIER);
        }
    }

    private UsageSnapshot toUsageSnapshot(UsagePort.UsageRow row) {
        return UsageSnapshot.of(row.totalSizeBytes(), row.quotaBytes());
    }

    private RetentionRun execute(EvictionPlan plan, List<SnapshotMetadata> inventory) {
        if (plan.isEmpty()) {
            RetentionStatus status = plan.getOutcome() == EvictionOutcome.EXHAUSTED
                ? RetentionStatus.EXHAUSTED_WITHOUT_SATISFACTION
                : RetentionStatus.COMPLIANT;
            return new RetentionRun(plan.getUserId(), plan, DeletionReport.empty(), status, 0L);
        }

        DeletionReport report;
        try {
            report = deletionPort.deleteSnapshots(plan.getUserId(), plan.getEvictions());
        } catch (RuntimeException e) {
            log.error("Deletion of {} snapshots failed for user {}", plan.size(), plan.getUserId(), e);
            report = DeletionReport.allFailed(plan.getEvictions());
        }

        RetentionStatus status;
        if (report.hasFailures()) {
            status = RetentionStatus.PARTIAL_DELETION_FAILURE;
        } else if (plan.getOutcome() == EvictionOutcome.EXHAUSTED) {
            status = RetentionStatus.EXHAUSTED_WITHOUT_SATISFACTION;
        } else {
            status = RetentionStatus.RECLAIMED;
        }

        return new RetentionRun(plan.getUserId(), plan, report, status, reclaimedBytes(plan, report, inventory));
    }

    private long reclaimedBytes(EvictionPlan plan, DeletionReport report, List<SnapshotMetadata> inventory) {
        if (!report.hasFailures()) {
            return plan.getReclaimedBytes();
        }
        Set<SnapshotId> deleted = Set.copyOf(report.deleted());
        return inventory.stream()
            .filter(s -> deleted.contains(s.getId()))
            .mapToLong(SnapshotMetadata::getSizeBytes)
            .sum();
    }

    private void logRun(String operation, RetentionRun run) {
        switch (run.getStatus()) {
            case COMPLIANT -> log.debug("{} for user {}: nothing to delete", operation, run.getUserId());
            case RECLAIMED -> log.info("{} for user {}: deleted {} snapshots, reclaimed {} bytes",
                operation, run.getUserId(), run.getDeletion().deleted().size(), run.getReclaimedBytes());
            case PARTIAL_DELETION_FAILURE -> log.warn("{} for user {}: {} of {} deletions failed",
                operation, run.getUserId(), run.getDeletion().failed().size(), run.getPlan().size());
            case EXHAUSTED_WITHOUT_SATISFACTION -> log.warn("{} for user {}: inventory exhausted, projected {} of {} bytes",
                operation, run.getUserId(), run.getPlan().getProjectedBytes(), run.getPlan().getUsageBefore().quotaBytes());
        }
    }
}
