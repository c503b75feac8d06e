package com.streamfirst.mindmap.retention.domain;

import lombok.NonNull;
import lombok.Value;

/**
 * Audit record of one retention run for one user: the plan that was computed, what the storage
 * collaborator did with it, and the resulting status.
 */
@Value
public class RetentionRun {
  @NonNull UserId userId;

  @NonNull EvictionPlan plan;

  @NonNull DeletionReport deletion;

  @NonNull RetentionStatus status;

  /** Bytes actually freed, counting only confirmed deletions. */
  long reclaimedBytes;
}
