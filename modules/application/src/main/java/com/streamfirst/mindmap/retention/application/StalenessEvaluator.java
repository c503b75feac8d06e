package com.streamfirst.mindmap.retention.application;

import com.streamfirst.mindmap.retention.domain.RetentionPolicy;
import com.streamfirst.mindmap.retention.domain.SnapshotMetadata;

import java.time.Instant;

/**
 * Decides whether a snapshot is eligible for cleanup.
 *
 * <p>Ordinary snapshots are stale once their age is strictly greater than the policy's max age.
 * Major snapshots are stale only past twice that. Age is supplied by the caller, so the
 * evaluator never reads the clock.
 */
public final class StalenessEvaluator {

  public boolean isStale(long ageMs, boolean major, RetentionPolicy policy) {
    long threshold = major ? policy.majorMaxAgeMillis() : policy.maxAgeMillis();
    return ageMs > threshold;
  }

  public boolean isStale(SnapshotMetadata snapshot, Instant now, RetentionPolicy policy) {
    return isStale(snapshot.ageMillisAt(now), snapshot.isMajor(), policy);
  }
}
