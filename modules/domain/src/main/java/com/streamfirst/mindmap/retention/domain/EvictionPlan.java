package com.streamfirst.mindmap.retention.domain;

import java.time.Instant;
import java.util.List;
import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

/**
 * Ordered list of snapshot ids a caller should delete, together with the policy and usage state
 * that produced it. Advisory: the engine never deletes anything itself.
 */
@Value
@Builder
public class EvictionPlan {
  @NonNull UserId userId;

  @NonNull PlanTier tier;

  @NonNull RetentionPolicy policy;

  /** Quota assessment taken before any eviction */
  @NonNull QuotaAssessment usageBefore;

  /** Snapshot ids in the order they should be deleted */
  @Singular List<SnapshotId> evictions;

  /** Bytes freed if every planned deletion succeeds */
  long reclaimedBytes;

  /** Usage expected after every planned deletion succeeds */
  long projectedBytes;

  @NonNull EvictionOutcome outcome;

  @NonNull Instant generatedAt;

  public boolean isEmpty() {
    return evictions.isEmpty();
  }

  public int size() {
    return evictions.size();
  }

  @Override
  public String toString() {
    return "EvictionPlan{"
        + "userId="
        + userId
        + ", tier="
        + tier
        + ", outcome="
        + outcome
        + ", evictions="
        + evictions.size()
        + ", reclaimedBytes="
        + reclaimedBytes
        + ", projectedBytes="
        + projectedBytes
        + '}';
  }
}
