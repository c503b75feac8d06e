package com.streamfirst.mindmap.retention.application;

import com.streamfirst.mindmap.retention.domain.RetentionPolicy;
import com.streamfirst.mindmap.retention.domain.SnapshotMetadata;

/**
 * Ranks snapshots for eviction; higher scores go first.
 *
 * <p>The score is the snapshot's age as a percentage of the policy's max age, halved for major
 * snapshots and boosted by 1.2 for payloads over 1 MiB. The scorer only ranks; it does not gate
 * on staleness. Ties are broken by the orchestrator, not here.
 */
public final class PriorityScorer {

  public static final long LARGE_SNAPSHOT_BYTES = 1_048_576L;
  public static final double BASE_WEIGHT = 100.0;
  public static final double MAJOR_WEIGHT = 0.5;
  public static final double LARGE_WEIGHT = 1.2;

  public double priority(SnapshotMetadata snapshot, long nowMs, RetentionPolicy policy) {
    double ageRatio = (double) (nowMs - snapshot.getCreatedAt().toEpochMilli()) / policy.maxAgeMillis();
    double score = ageRatio * BASE_WEIGHT;

    if (snapshot.isMajor()) {
      score *= MAJOR_WEIGHT;
    }
    if (snapshot.getSizeBytes() > LARGE_SNAPSHOT_BYTES) {
      score *= LARGE_WEIGHT;
    }
    return score;
  }
}
