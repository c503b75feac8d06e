package com.streamfirst.mindmap.retention.application;

import com.streamfirst.mindmap.retention.domain.*;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Produces the ordered eviction plan for one user.
 *
 * <p>A single pass over one consistent inventory and usage reading:
 * <ol>
 * <li>Resolve the tier's policy.</li>
 * <li>Assess quota; at or under 100% the plan is empty ({@link EvictionOutcome#NOT_REQUIRED}).</li>
 * <li>Mark every snapshot stale or not and score its priority.</li>
 * <li>Order stale snapshots ahead of fresh ones, each group by descending priority and then by
 * ascending creation time, and take snapshots until projected usage is back under quota
 * ({@link EvictionOutcome#SATISFIED}) or the inventory runs out
 * ({@link EvictionOutcome#EXHAUSTED}).</li>
 * </ol>
 *
 * <p>Pure: no I/O, no clock reads, no shared state. The caller deletes and may re-run after a
 * partial failure; deleted snapshots simply drop out of the next inventory.
 */
@Slf4j
@RequiredArgsConstructor
public final class EvictionOrchestrator {

  private static final Comparator<ScoredSnapshot> EVICTION_ORDER =
      Comparator.comparing(ScoredSnapshot::stale, Comparator.reverseOrder())
          .thenComparing(ScoredSnapshot::priority, Comparator.reverseOrder())
          .thenComparing(s -> s.snapshot().getCreatedAt())
          .thenComparing(s -> s.snapshot().getId().value());

  private final PolicyCatalog catalog;
  private final StalenessEvaluator stalenessEvaluator;
  private final PriorityScorer priorityScorer;
  private final QuotaAssessor quotaAssessor;

  public static EvictionOrchestrator withCatalog(PolicyCatalog catalog) {
    return new EvictionOrchestrator(
        catalog, new StalenessEvaluator(), new PriorityScorer(), new QuotaAssessor(catalog));
  }

  /**
   * Computes the eviction plan.
   *
   * @param userId owner of the inventory
   * @param inventory every snapshot the user has, read once
   * @param tier the user's plan tier
   * @param usage aggregate usage, empty if the store reported no rows
   * @param now reference time for ages
   */
  public EvictionPlan plan(UserId userId, List<SnapshotMetadata> inventory, PlanTier tier,
                           Optional<UsageSnapshot> usage, Instant now) {
    RetentionPolicy policy = catalog.policyFor(tier);
    QuotaAssessment before = quotaAssessor.assess(usage);

    var plan = EvictionPlan.builder()
        .userId(userId)
        .tier(tier)
        .policy(policy)
        .usageBefore(before)
        .generatedAt(now);

    if (!before.exceeded()) {
      log.debug("User {} at {}% of quota, no eviction needed", userId, String.format("%.1f", before.percentage()));
      return plan.outcome(EvictionOutcome.NOT_REQUIRED)
          .projectedBytes(before.usageBytes())
          .build();
    }

    List<ScoredSnapshot> ranked = rank(inventory, policy, now);
    UsageSnapshot projected = UsageSnapshot.of(before.usageBytes(), before.quotaBytes());
    long reclaimed = 0L;

    for (ScoredSnapshot candidate : ranked) {
      if (!quotaAssessor.assess(projected).exceeded()) {
        break;
      }
      plan.eviction(candidate.snapshot().getId());
      reclaimed += candidate.snapshot().getSizeBytes();
      projected = projected.minus(candidate.snapshot().getSizeBytes());
      log.debug("Planned eviction of {} (stale={}, priority={})",
          candidate.snapshot().getId(), candidate.stale(), candidate.priority());
    }

    EvictionOutcome outcome = quotaAssessor.assess(projected).exceeded()
        ? EvictionOutcome.EXHAUSTED
        : EvictionOutcome.SATISFIED;

    return plan.outcome(outcome)
        .reclaimedBytes(reclaimed)
        .projectedBytes(projected.totalBytes())
        .build();
  }

  public RetentionPolicy policyFor(PlanTier tier) {
    return catalog.policyFor(tier);
  }

  /**
   * Plans the deletion of every stale snapshot regardless of quota. The plan still records the
   * usage reading it was taken against and the usage left once the stale snapshots are gone.
   */
  public EvictionPlan purgePlan(UserId userId, List<SnapshotMetadata> inventory, PlanTier tier,
                                Optional<UsageSnapshot> usage, Instant now) {
    QuotaAssessment before = quotaAssessor.assess(usage);
    List<SnapshotMetadata> stale = staleSnapshots(inventory, tier, now);
    long reclaimed = stale.stream().mapToLong(SnapshotMetadata::getSizeBytes).sum();

    return EvictionPlan.builder()
        .userId(userId)
        .tier(tier)
        .policy(catalog.policyFor(tier))
        .usageBefore(before)
        .evictions(stale.stream().map(SnapshotMetadata::getId).toList())
        .reclaimedBytes(reclaimed)
        .projectedBytes(Math.max(0L, before.usageBytes() - reclaimed))
        .outcome(stale.isEmpty() ? EvictionOutcome.NOT_REQUIRED : EvictionOutcome.SATISFIED)
        .generatedAt(now)
        .build();
  }

  /**
   * Lists every stale snapshot regardless of quota, oldest first. Used for age-based sweeps.
   */
  public List<SnapshotMetadata> staleSnapshots(List<SnapshotMetadata> inventory, PlanTier tier, Instant now) {
    RetentionPolicy policy = catalog.policyFor(tier);
    return inventory.stream()
        .filter(s -> stalenessEvaluator.isStale(s, now, policy))
        .sorted(Comparator.comparing(SnapshotMetadata::getCreatedAt)
            .thenComparing(s -> s.getId().value()))
        .toList();
  }

  List<ScoredSnapshot> rank(List<SnapshotMetadata> inventory, RetentionPolicy policy, Instant now) {
    long nowMs = now.toEpochMilli();
    List<ScoredSnapshot> scored = new ArrayList<>(inventory.size());
    for (SnapshotMetadata snapshot : inventory) {
      scored.add(new ScoredSnapshot(
          snapshot,
          stalenessEvaluator.isStale(snapshot, now, policy),
          priorityScorer.priority(snapshot, nowMs, policy)));
    }
    scored.sort(EVICTION_ORDER);
    return scored;
  }

  record ScoredSnapshot(SnapshotMetadata snapshot, boolean stale, double priority) {}
}
